package com.pareview.app.core.engine.override;

import com.pareview.app.core.exception.OverrideValidationException;
import com.pareview.app.core.exception.ReviewConstraintViolation;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import com.pareview.app.integration.models.decision.DecisionOverride;
import com.pareview.app.integration.models.task.HumanDecisionRequest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Checks a reviewer decision against the candidate it replaces.
 *
 * <p>A decision that keeps the candidate outcome is a confirmation and needs nothing more. Any
 * other outcome is an override and needs a justification. An override into or out of a deny-type
 * outcome also needs a clinical basis.</p>
 */
public final class OverrideValidator {

    private OverrideValidator() {
    }

    /**
     * @return the override to record, or null when the reviewer confirmed the candidate
     * @throws OverrideValidationException if a required field is missing
     */
    public static DecisionOverride validate(DecisionOutcome candidate, HumanDecisionRequest request, Instant now) {
        DecisionOutcome requested = request.getFinalOutcome();
        if (requested == candidate) {
            return null;
        }
        Map<String, String> variables = Map.of("prior", String.valueOf(candidate), "final", String.valueOf(requested));
        if (isBlank(request.getJustification())) {
            throw new OverrideValidationException(PaReviewInternalErrorCodes.OVERRIDE_JUSTIFICATION_REQUIRED, variables,
                    List.of(new ReviewConstraintViolation("justification", "must not be blank for an override")));
        }
        boolean touchesDenial = requested.isDenyType() || (candidate != null && candidate.isDenyType());
        if (touchesDenial && isBlank(request.getClinicalBasis())) {
            throw new OverrideValidationException(PaReviewInternalErrorCodes.OVERRIDE_CLINICAL_BASIS_REQUIRED, variables,
                    List.of(new ReviewConstraintViolation("clinicalBasis",
                            "must not be blank for an override into or out of a denial")));
        }
        return DecisionOverride.builder()
                .priorOutcome(candidate)
                .finalOutcome(requested)
                .justification(request.getJustification().trim())
                .clinicalBasis(isBlank(request.getClinicalBasis()) ? null : request.getClinicalBasis().trim())
                .reviewerId(request.getReviewerId())
                .reviewerRole(request.getReviewerRole())
                .createdAt(now)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
