package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.ledger.TaskRecord;
import com.pareview.app.integration.models.request.PriorAuthRequest;
import reactor.core.publisher.Mono;

/**
 * Drives the tasks of a run through its ledger, one at a time, in the fixed pipeline order.
 *
 * <h2>Durability</h2>
 * <p>{@link #complete} writes the checkpoint before it updates the ledger. A crash in between
 * leaves the task in progress with a checkpoint written after it started; the next
 * {@link #advance} or {@link #resume} marks such a task completed without running it again.</p>
 *
 * <h2>Failure</h2>
 * <p>A recoverable task error halts the run with the task still in progress. Driving the run
 * again re-executes that task from scratch. Invariant and decision-policy errors propagate.</p>
 */
public interface IReviewSequencer {

    /**
     * Creates a ledger with every task not started and stores the submission.
     */
    Mono<TaskLedger> startRun(String runId, PriorAuthRequest submission);

    /**
     * Stores a corrected submission as a new version. Only allowed until the submission-reading
     * task has completed.
     */
    Mono<TaskLedger> amendSubmission(String runId, PriorAuthRequest submission);

    /**
     * Selects the first task that is not completed. A not-started task is moved to in progress;
     * an in-progress task is returned unchanged.
     *
     * @return the task to execute, or empty when every task is completed
     */
    Mono<TaskRecord> advance(String runId);

    /**
     * Writes the task's checkpoint, then marks the task completed.
     */
    Mono<TaskLedger> complete(String runId, String taskId, Object payload);

    /**
     * Reloads the ledger, reconciles an interrupted completion and reports progress.
     */
    Mono<ResumeSummary> resume(String runId);

    /**
     * Executes tasks until the run completes, halts, or waits for a reviewer.
     */
    Mono<RunOutcome> run(String runId);

    Mono<TaskLedger> getLedger(String runId);
}
