package com.pareview.app.integration.enumerations;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class RunStatusTest {

    private Locale previous;

    @BeforeEach
    void useTurkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    @DisplayName("wire values do not depend on the default locale")
    void wireValuesAreLocaleIndependent() {
        assertEquals("initialized", RunStatus.INITIALIZED.toWireValue());
        assertEquals("in_progress", RunStatus.IN_PROGRESS.toWireValue());
        assertEquals("sections_complete", RunStatus.SECTIONS_COMPLETE.toWireValue());
        assertEquals("complete", RunStatus.COMPLETE.toWireValue());
    }

    @Test
    @DisplayName("every wire value reads back to its status")
    void wireValuesReadBack() {
        for (RunStatus status : RunStatus.values()) {
            assertEquals(status, RunStatus.fromWireValue(status.toWireValue()));
        }
        assertThrows(IllegalArgumentException.class, () -> RunStatus.fromWireValue("paused"));
    }
}
