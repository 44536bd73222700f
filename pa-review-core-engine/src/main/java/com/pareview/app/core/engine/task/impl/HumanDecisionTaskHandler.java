package com.pareview.app.core.engine.task.impl;

import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.core.exception.AwaitingHumanInputException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.models.task.RecommendationResult;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Parks the run until a reviewer decides. The task is completed by
 * {@link com.pareview.app.core.engine.override.HumanDecisionService}, never by this handler.
 */
public class HumanDecisionTaskHandler implements IReviewTaskHandler {

    @Override
    public String taskId() {
        return ReviewTaskIds.HUMAN_DECISION;
    }

    @Override
    public boolean requiresHumanInput() {
        return true;
    }

    @Override
    public Mono<Object> execute(IReviewTaskContext context) {
        // the candidate must exist before a reviewer is asked for a decision
        return context.readCheckpoint(ReviewTaskIds.RECOMMENDATION, RecommendationResult.class)
                .flatMap(recommendation -> Mono.error(new AwaitingHumanInputException(
                        PaReviewInternalErrorCodes.AWAITING_HUMAN_DECISION,
                        Map.of("runId", context.getRunId(), "taskId", context.getTaskId()))));
    }
}
