package com.pareview.app.core.engine.decision;

import com.pareview.app.core.exception.DecisionPolicyException;
import com.pareview.app.core.exception.ReviewConfigurationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Thresholds and permitted outcomes of the {@link DecisionResolver}.
 *
 * <p>All checks run in the constructor, so a resolver can never be built from a configuration that
 * would let it emit an outcome it is not permitted to emit. {@code DENY_CANDIDATE} is only allowed
 * together with strict denial, and strict denial is off unless asked for.</p>
 */
@Getter
@ToString
public class DecisionResolverConfig {

    private final double criteriaPassThreshold;
    private final double criteriaBorderlineThreshold;
    private final double confidenceApproveThreshold;
    private final double confidenceFlagThreshold;
    private final double strictDenialConfidenceThreshold;
    private final boolean strictDenialEnabled;
    private final Set<DecisionOutcome> allowedOutcomes;

    @Builder(toBuilder = true)
    public DecisionResolverConfig(double criteriaPassThreshold,
                                  double criteriaBorderlineThreshold,
                                  double confidenceApproveThreshold,
                                  double confidenceFlagThreshold,
                                  double strictDenialConfidenceThreshold,
                                  boolean strictDenialEnabled,
                                  Set<DecisionOutcome> allowedOutcomes) {
        requirePercentage("criteriaPassThreshold", criteriaPassThreshold);
        requirePercentage("criteriaBorderlineThreshold", criteriaBorderlineThreshold);
        requirePercentage("confidenceApproveThreshold", confidenceApproveThreshold);
        requirePercentage("confidenceFlagThreshold", confidenceFlagThreshold);
        requirePercentage("strictDenialConfidenceThreshold", strictDenialConfidenceThreshold);
        if (criteriaBorderlineThreshold > criteriaPassThreshold) {
            throw invalid("criteriaBorderlineThreshold", "must not exceed criteriaPassThreshold");
        }
        if (confidenceFlagThreshold > confidenceApproveThreshold) {
            throw invalid("confidenceFlagThreshold", "must not exceed confidenceApproveThreshold");
        }

        Set<DecisionOutcome> outcomes = allowedOutcomes == null || allowedOutcomes.isEmpty()
                ? EnumSet.of(DecisionOutcome.APPROVE_CANDIDATE, DecisionOutcome.PEND)
                : EnumSet.copyOf(allowedOutcomes);
        if (!outcomes.contains(DecisionOutcome.APPROVE_CANDIDATE) || !outcomes.contains(DecisionOutcome.PEND)) {
            throw invalid("allowedOutcomes", "must contain APPROVE_CANDIDATE and PEND");
        }
        if (outcomes.contains(DecisionOutcome.DENY_CANDIDATE) && !strictDenialEnabled) {
            throw new DecisionPolicyException(PaReviewInternalErrorCodes.DECISION_OUTCOME_NOT_PERMITTED,
                    Map.of("reason", "DENY_CANDIDATE is allowed but strict denial is disabled"));
        }
        if (strictDenialEnabled && !outcomes.contains(DecisionOutcome.DENY_CANDIDATE)) {
            throw new DecisionPolicyException(PaReviewInternalErrorCodes.DECISION_OUTCOME_NOT_PERMITTED,
                    Map.of("reason", "strict denial is enabled but DENY_CANDIDATE is not an allowed outcome"));
        }

        this.criteriaPassThreshold = criteriaPassThreshold;
        this.criteriaBorderlineThreshold = criteriaBorderlineThreshold;
        this.confidenceApproveThreshold = confidenceApproveThreshold;
        this.confidenceFlagThreshold = confidenceFlagThreshold;
        this.strictDenialConfidenceThreshold = strictDenialConfidenceThreshold;
        this.strictDenialEnabled = strictDenialEnabled;
        this.allowedOutcomes = Set.copyOf(outcomes);
    }

    /**
     * A builder seeded with the default thresholds: criteria 80/60, confidence 80/60, strict-denial
     * confidence 90, strict denial disabled.
     */
    public static DecisionResolverConfigBuilder builder() {
        return new DecisionResolverConfigBuilder()
                .criteriaPassThreshold(80.0)
                .criteriaBorderlineThreshold(60.0)
                .confidenceApproveThreshold(80.0)
                .confidenceFlagThreshold(60.0)
                .strictDenialConfidenceThreshold(90.0)
                .strictDenialEnabled(false)
                .allowedOutcomes(EnumSet.of(DecisionOutcome.APPROVE_CANDIDATE, DecisionOutcome.PEND));
    }

    public static DecisionResolverConfig defaults() {
        return builder().build();
    }

    public static DecisionResolverConfig strictDenial() {
        return builder()
                .strictDenialEnabled(true)
                .allowedOutcomes(EnumSet.allOf(DecisionOutcome.class))
                .build();
    }

    public boolean isAllowed(DecisionOutcome outcome) {
        return allowedOutcomes.contains(outcome);
    }

    private static void requirePercentage(String key, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw invalid(key, "must be between 0 and 100 but was " + value);
        }
    }

    private static ReviewConfigurationException invalid(String key, String reason) {
        return new ReviewConfigurationException(PaReviewInternalErrorCodes.CONFIGURATION_INVALID,
                Map.of("key", "resolver." + key, "reason", reason));
    }
}
