package com.pareview.app.integration.models.task;

import com.pareview.app.integration.models.decision.ConfidenceAssessment;
import com.pareview.app.integration.models.decision.Decision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResult {

    private ConfidenceAssessment confidence;

    private Decision decision;

    private String summary;
}
