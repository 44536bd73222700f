package com.pareview.app.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum RunStatus {
    INITIALIZED,
    IN_PROGRESS,
    SECTIONS_COMPLETE,
    COMPLETE;

    @JsonValue
    public String toWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown run status: " + value));
    }
}
