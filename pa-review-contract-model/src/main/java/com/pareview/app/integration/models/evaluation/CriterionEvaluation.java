package com.pareview.app.integration.models.evaluation;

import com.pareview.app.integration.enumerations.CriterionVerdict;
import com.pareview.app.integration.enumerations.RequirementLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Verdict for one policy criterion, with the evidence it rests on. Produced once per run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CriterionEvaluation {

    private String criterionId;

    private String text;

    private RequirementLevel requirementLevel;

    private String groupId;

    private CriterionVerdict verdict;

    private List<EvidenceReference> supportingEvidence;

    private int confidence;

    private String notes;
}
