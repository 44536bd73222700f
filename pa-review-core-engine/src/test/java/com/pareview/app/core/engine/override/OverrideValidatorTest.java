package com.pareview.app.core.engine.override;

import com.pareview.app.core.exception.OverrideValidationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import com.pareview.app.integration.models.decision.DecisionOverride;
import com.pareview.app.integration.models.task.HumanDecisionRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OverrideValidatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:30Z");

    private static HumanDecisionRequest.HumanDecisionRequestBuilder request(DecisionOutcome outcome) {
        return HumanDecisionRequest.builder()
                .finalOutcome(outcome)
                .reviewerId("rn-17")
                .reviewerRole("nurse-reviewer");
    }

    @Test
    @DisplayName("confirming the candidate needs no justification")
    void confirmation() {
        assertNull(OverrideValidator.validate(DecisionOutcome.PEND, request(DecisionOutcome.PEND).build(), NOW));
    }

    @Test
    @DisplayName("an override records prior and final outcome with the reviewer")
    void overrideRecorded() {
        DecisionOverride override = OverrideValidator.validate(DecisionOutcome.PEND,
                request(DecisionOutcome.APPROVE_CANDIDATE).justification("  Imaging report received by fax ").build(), NOW);

        assertEquals(DecisionOutcome.PEND, override.getPriorOutcome());
        assertEquals(DecisionOutcome.APPROVE_CANDIDATE, override.getFinalOutcome());
        assertEquals("Imaging report received by fax", override.getJustification());
        assertNull(override.getClinicalBasis());
        assertEquals("rn-17", override.getReviewerId());
        assertEquals("nurse-reviewer", override.getReviewerRole());
        assertEquals(NOW, override.getCreatedAt());
    }

    @Test
    @DisplayName("an override without justification is rejected")
    void justificationRequired() {
        OverrideValidationException error = assertThrows(OverrideValidationException.class,
                () -> OverrideValidator.validate(DecisionOutcome.PEND,
                        request(DecisionOutcome.APPROVE_CANDIDATE).justification("   ").build(), NOW));

        assertEquals(PaReviewInternalErrorCodes.OVERRIDE_JUSTIFICATION_REQUIRED, error.getErrorInfo());
        assertEquals("justification", error.getViolations().get(0).field());
        assertTrue(error.isRecoverable());
    }

    @Test
    @DisplayName("overriding into a denial needs a clinical basis")
    void denyNeedsClinicalBasis() {
        OverrideValidationException error = assertThrows(OverrideValidationException.class,
                () -> OverrideValidator.validate(DecisionOutcome.PEND,
                        request(DecisionOutcome.DENY_CANDIDATE).justification("Criteria clearly unmet").build(), NOW));

        assertEquals(PaReviewInternalErrorCodes.OVERRIDE_CLINICAL_BASIS_REQUIRED, error.getErrorInfo());
    }

    @Test
    @DisplayName("overriding out of a denial needs a clinical basis")
    void outOfDenyNeedsClinicalBasis() {
        assertThrows(OverrideValidationException.class,
                () -> OverrideValidator.validate(DecisionOutcome.DENY_CANDIDATE,
                        request(DecisionOutcome.APPROVE_CANDIDATE).justification("Peer to peer call").build(), NOW));
    }

    @Test
    @DisplayName("a denial override with both fields is accepted")
    void denyWithClinicalBasis() {
        DecisionOverride override = OverrideValidator.validate(DecisionOutcome.PEND,
                request(DecisionOutcome.DENY_CANDIDATE)
                        .justification("No conservative therapy in twelve months of notes")
                        .clinicalBasis("Policy section 2.1 requires six weeks of therapy")
                        .build(), NOW);

        assertEquals(DecisionOutcome.DENY_CANDIDATE, override.getFinalOutcome());
        assertEquals("Policy section 2.1 requires six weeks of therapy", override.getClinicalBasis());
    }
}
