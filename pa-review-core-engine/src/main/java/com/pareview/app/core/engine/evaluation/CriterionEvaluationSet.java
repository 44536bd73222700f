package com.pareview.app.core.engine.evaluation;

import com.pareview.app.integration.models.evaluation.CriterionEvaluation;
import com.pareview.app.integration.models.evaluation.CriterionGroupResult;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Evaluator output: one evaluation per criterion in input order, one result per group, and the
 * share of verdict units that are met.
 */
@Getter
@Builder
@ToString
public class CriterionEvaluationSet {

    private final List<CriterionEvaluation> evaluations;
    private final List<CriterionGroupResult> groupResults;
    private final double percentMet;
    private final boolean allEvidenceGathered;
}
