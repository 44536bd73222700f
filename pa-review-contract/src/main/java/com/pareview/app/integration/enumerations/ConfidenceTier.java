package com.pareview.app.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ConfidenceTier {
    LOW(0.0),
    MEDIUM(60.0),
    HIGH(80.0);

    private final double lowerBound;

    public static ConfidenceTier classify(double score) {
        if (score >= HIGH.lowerBound) {
            return HIGH;
        }
        if (score >= MEDIUM.lowerBound) {
            return MEDIUM;
        }
        return LOW;
    }
}
