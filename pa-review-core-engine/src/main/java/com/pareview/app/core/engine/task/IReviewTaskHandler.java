package com.pareview.app.core.engine.task;

import reactor.core.publisher.Mono;

/**
 * Domain logic of one pipeline task.
 *
 * <p>A handler must tolerate being executed again from scratch: a task interrupted before its
 * checkpoint was written is re-run in full. The emitted payload becomes the task's checkpoint.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * public Mono<Object> execute(IReviewTaskContext context) {
 *     return context.readCheckpoint(ReviewTaskIds.INTAKE, IntakeSummary.class)
 *             .map(this::summarize);
 * }
 * }</pre>
 */
public interface IReviewTaskHandler {

    String taskId();

    Mono<Object> execute(IReviewTaskContext context);

    /**
     * Tasks that need a reviewer halt the run until the decision is recorded externally.
     */
    default boolean requiresHumanInput() {
        return false;
    }

    /**
     * Only a submission-reading task may see the raw request; all others read checkpoints.
     */
    default boolean readsSubmission() {
        return false;
    }
}
