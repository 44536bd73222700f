package com.pareview.app.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How directly a fact establishes what it is used for, with the confidence band each level maps to.
 */
@Getter
@AllArgsConstructor
public enum EvidenceDirectness {
    DIRECT(90, 100, 95),
    STRONG_INFERENCE(70, 89, 80),
    REASONABLE_INFERENCE(50, 69, 60),
    WEAK(0, 49, 40);

    private final int minConfidence;
    private final int maxConfidence;
    private final int defaultConfidence;

    /**
     * Resolves a confidence for a fact at this level. An explicit value is clamped into the band,
     * a missing one falls back to the band default.
     */
    public int resolveConfidence(Integer explicitConfidence) {
        if (explicitConfidence == null) {
            return defaultConfidence;
        }
        return Math.max(minConfidence, Math.min(maxConfidence, explicitConfidence));
    }
}
