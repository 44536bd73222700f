package com.pareview.app.core.engine.task.impl;

import com.pareview.app.core.engine.evaluation.CriterionEvaluationSet;
import com.pareview.app.core.engine.evaluation.CriterionEvaluator;
import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.models.policy.PolicyCandidate;
import com.pareview.app.integration.models.task.EvidenceMappingResult;
import com.pareview.app.integration.models.task.IntakeSummary;
import com.pareview.app.integration.models.task.PolicyRetrievalResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Maps the case's clinical facts onto the selected policy's criteria.
 */
@Slf4j
public class EvidenceMappingTaskHandler implements IReviewTaskHandler {

    private final CriterionEvaluator evaluator;

    public EvidenceMappingTaskHandler(CriterionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public String taskId() {
        return ReviewTaskIds.EVIDENCE_MAPPING;
    }

    @Override
    public Mono<Object> execute(IReviewTaskContext context) {
        return Mono.zip(context.readCheckpoint(ReviewTaskIds.INTAKE, IntakeSummary.class),
                        context.readCheckpoint(ReviewTaskIds.POLICY_RETRIEVAL, PolicyRetrievalResult.class))
                .map(inputs -> map(inputs.getT1(), inputs.getT2().getSelectedPolicy()));
    }

    private EvidenceMappingResult map(IntakeSummary intake, PolicyCandidate policy) {
        if (policy == null) {
            log.info("No policy selected, evidence mapping skipped: caseId={}", intake.getCaseId());
            return EvidenceMappingResult.builder()
                    .skipped(true)
                    .evaluations(List.of())
                    .groupResults(List.of())
                    .percentMet(0.0)
                    .allEvidenceGathered(false)
                    .build();
        }
        CriterionEvaluationSet set = evaluator.evaluate(policy.getPolicyId(), policy.getCriteria(), intake.getClinicalFacts());
        log.info("Evidence mapped: caseId={}, policyId={}, percentMet={}", intake.getCaseId(), policy.getPolicyId(),
                set.getPercentMet());
        return EvidenceMappingResult.builder()
                .policyId(policy.getPolicyId())
                .skipped(false)
                .evaluations(set.getEvaluations())
                .groupResults(set.getGroupResults())
                .percentMet(set.getPercentMet())
                .allEvidenceGathered(set.isAllEvidenceGathered())
                .build();
    }
}
