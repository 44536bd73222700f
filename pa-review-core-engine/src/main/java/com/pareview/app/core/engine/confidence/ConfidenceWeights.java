package com.pareview.app.core.engine.confidence;

import com.pareview.app.core.exception.ReviewConfigurationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Weights of the five confidence sub-scores. Validated on construction: each weight lies in
 * [0, 1] and together they sum to 1.0.
 */
@Getter
@ToString
public class ConfidenceWeights {

    public static final double SUM_TOLERANCE = 1e-6;

    private final double provider;
    private final double codes;
    private final double policyMatch;
    private final double clinicalCriteria;
    private final double documentationQuality;

    @Builder
    public ConfidenceWeights(double provider, double codes, double policyMatch,
                             double clinicalCriteria, double documentationQuality) {
        requireUnitInterval("provider", provider);
        requireUnitInterval("codes", codes);
        requireUnitInterval("policyMatch", policyMatch);
        requireUnitInterval("clinicalCriteria", clinicalCriteria);
        requireUnitInterval("documentationQuality", documentationQuality);

        double sum = provider + codes + policyMatch + clinicalCriteria + documentationQuality;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ReviewConfigurationException(PaReviewInternalErrorCodes.CONFIDENCE_WEIGHTS_INVALID,
                    Map.of("sum", String.valueOf(sum)));
        }

        this.provider = provider;
        this.codes = codes;
        this.policyMatch = policyMatch;
        this.clinicalCriteria = clinicalCriteria;
        this.documentationQuality = documentationQuality;
    }

    public static ConfidenceWeights defaults() {
        return ConfidenceWeights.builder()
                .provider(0.20)
                .codes(0.15)
                .policyMatch(0.20)
                .clinicalCriteria(0.35)
                .documentationQuality(0.10)
                .build();
    }

    private static void requireUnitInterval(String key, double weight) {
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new ReviewConfigurationException(PaReviewInternalErrorCodes.CONFIGURATION_INVALID,
                    Map.of("key", "weights." + key, "reason", "must be between 0 and 1 but was " + weight));
        }
    }
}
