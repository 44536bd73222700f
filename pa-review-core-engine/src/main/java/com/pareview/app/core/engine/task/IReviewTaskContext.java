package com.pareview.app.core.engine.task;

import com.pareview.app.integration.models.request.PriorAuthRequest;
import reactor.core.publisher.Mono;

/**
 * What a running task can see: its run and the checkpoints of earlier tasks.
 */
public interface IReviewTaskContext {

    String getRunId();

    String getCaseId();

    String getTaskId();

    /**
     * Reads the latest checkpoint of an earlier task.
     *
     * @throws com.pareview.app.core.exception.LedgerInvariantViolationException (as an error signal)
     *         if the task is not earlier in the pipeline or has no checkpoint
     */
    <T> Mono<T> readCheckpoint(String taskId, Class<T> payloadType);

    /**
     * Reads the latest submitted request. Only available to tasks that declare
     * {@link IReviewTaskHandler#readsSubmission()}.
     */
    Mono<PriorAuthRequest> readSubmission();
}
