package com.pareview.app.core.engine.task.impl;

import com.pareview.app.core.engine.confidence.ConfidenceAggregator;
import com.pareview.app.core.engine.confidence.ConfidenceSubScoreCalculator;
import com.pareview.app.core.engine.decision.DecisionInput;
import com.pareview.app.core.engine.decision.DecisionResolver;
import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.models.decision.ConfidenceAssessment;
import com.pareview.app.integration.models.decision.Decision;
import com.pareview.app.integration.models.task.ComplianceResult;
import com.pareview.app.integration.models.task.EvidenceMappingResult;
import com.pareview.app.integration.models.task.PolicyRetrievalResult;
import com.pareview.app.integration.models.task.RecommendationResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Scores the case and resolves the candidate decision.
 */
@Slf4j
public class RecommendationTaskHandler implements IReviewTaskHandler {

    private final ConfidenceAggregator aggregator;
    private final DecisionResolver resolver;

    public RecommendationTaskHandler(ConfidenceAggregator aggregator, DecisionResolver resolver) {
        this.aggregator = aggregator;
        this.resolver = resolver;
    }

    @Override
    public String taskId() {
        return ReviewTaskIds.RECOMMENDATION;
    }

    @Override
    public Mono<Object> execute(IReviewTaskContext context) {
        return Mono.zip(context.readCheckpoint(ReviewTaskIds.COMPLIANCE, ComplianceResult.class),
                        context.readCheckpoint(ReviewTaskIds.POLICY_RETRIEVAL, PolicyRetrievalResult.class),
                        context.readCheckpoint(ReviewTaskIds.EVIDENCE_MAPPING, EvidenceMappingResult.class))
                .map(inputs -> recommend(context.getCaseId(), inputs.getT1(), inputs.getT2(), inputs.getT3()));
    }

    private RecommendationResult recommend(String caseId, ComplianceResult compliance,
                                           PolicyRetrievalResult policy, EvidenceMappingResult evidence) {
        ConfidenceAssessment assessment = aggregator.aggregate(
                ConfidenceSubScoreCalculator.calculate(compliance, policy, evidence));
        Decision decision = resolver.resolve(DecisionInput.from(compliance, policy, evidence, assessment));

        String summary = String.format(Locale.ROOT, "%s at %.1f confidence (%s), %d gap(s): %s",
                decision.getOutcome(), assessment.getOverall(), assessment.getTier(),
                decision.getGaps().size(), decision.getRationale());
        log.info("Recommendation resolved: caseId={}, outcome={}, confidence={}, tier={}, gates={}",
                caseId, decision.getOutcome(), assessment.getOverall(), assessment.getTier(), decision.getEvaluatedGates());

        return RecommendationResult.builder()
                .confidence(assessment)
                .decision(decision)
                .summary(summary)
                .build();
    }
}
