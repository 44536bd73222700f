package com.pareview.app.integration.models.task;

import com.pareview.app.integration.models.evaluation.CriterionEvaluation;
import com.pareview.app.integration.models.evaluation.CriterionGroupResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Criterion evaluator output for the selected policy.
 *
 * <p>{@code skipped} is set when no policy was located, in which case no criteria were evaluated.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceMappingResult {

    private String policyId;

    private boolean skipped;

    private List<CriterionEvaluation> evaluations;

    private List<CriterionGroupResult> groupResults;

    private double percentMet;

    private boolean allEvidenceGathered;
}
