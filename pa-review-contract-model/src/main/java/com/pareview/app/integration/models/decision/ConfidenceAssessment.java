package com.pareview.app.integration.models.decision;

import com.pareview.app.integration.enumerations.ConfidenceTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfidenceAssessment {

    private ConfidenceSubScores subScores;

    private double overall;

    private ConfidenceTier tier;
}
