package com.pareview.app.core.engine.confidence;

import com.pareview.app.integration.enumerations.ConfidenceTier;
import com.pareview.app.integration.models.decision.ConfidenceAssessment;
import com.pareview.app.integration.models.decision.ConfidenceSubScores;

/**
 * Fixed-weight linear combination of the confidence sub-scores. Pure; no I/O.
 */
public class ConfidenceAggregator {

    private final ConfidenceWeights weights;

    public ConfidenceAggregator(ConfidenceWeights weights) {
        this.weights = weights;
    }

    public ConfidenceAggregator() {
        this(ConfidenceWeights.defaults());
    }

    /**
     * Combines the sub-scores into an overall 0-100 value and classifies it.
     *
     * @throws IllegalArgumentException if a sub-score lies outside 0-100
     */
    public ConfidenceAssessment aggregate(ConfidenceSubScores subScores) {
        double provider = requireScore("provider", subScores.getProvider());
        double codes = requireScore("codes", subScores.getCodes());
        double policy = requireScore("policyMatch", subScores.getPolicyMatch());
        double clinical = requireScore("clinicalCriteria", subScores.getClinicalCriteria());
        double docs = requireScore("documentationQuality", subScores.getDocumentationQuality());

        double overall = weights.getProvider() * provider
                + weights.getCodes() * codes
                + weights.getPolicyMatch() * policy
                + weights.getClinicalCriteria() * clinical
                + weights.getDocumentationQuality() * docs;
        // floating point drift must not push a perfect case past 100
        overall = Math.max(0.0, Math.min(100.0, overall));

        return ConfidenceAssessment.builder()
                .subScores(subScores)
                .overall(overall)
                .tier(ConfidenceTier.classify(overall))
                .build();
    }

    public ConfidenceWeights getWeights() {
        return weights;
    }

    private static double requireScore(String name, double score) {
        if (Double.isNaN(score) || score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Sub-score " + name + " must be between 0 and 100 but was " + score);
        }
        return score;
    }
}
