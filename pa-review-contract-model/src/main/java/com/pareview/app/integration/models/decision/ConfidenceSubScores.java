package com.pareview.app.integration.models.decision;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The five 0-100 inputs of the confidence aggregate.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfidenceSubScores {

    private double provider;

    private double codes;

    private double policyMatch;

    private double clinicalCriteria;

    private double documentationQuality;
}
