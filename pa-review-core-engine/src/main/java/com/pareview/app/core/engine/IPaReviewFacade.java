package com.pareview.app.core.engine;

import com.pareview.app.core.engine.audit.ReviewAuditEntry;
import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.sequencer.IReviewSequencer;
import com.pareview.app.core.engine.sequencer.ResumeSummary;
import com.pareview.app.core.engine.sequencer.RunOutcome;
import com.pareview.app.integration.models.request.PriorAuthRequest;
import com.pareview.app.integration.models.task.HumanDecisionRecord;
import com.pareview.app.integration.models.task.HumanDecisionRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point for driving prior-authorization reviews.
 */
public interface IPaReviewFacade {

    Mono<Void> initialize();

    Mono<Void> shutdown();

    /**
     * Starts a run for the case and returns its run id. Nothing executes until {@link #run}.
     */
    Mono<String> submit(PriorAuthRequest request);

    /**
     * Executes tasks until the run completes, halts on a failure, or waits for a reviewer.
     */
    Mono<RunOutcome> run(String runId);

    Mono<RunOutcome> submitAndRun(PriorAuthRequest request);

    Mono<ResumeSummary> resume(String runId);

    Mono<TaskLedger> amendSubmission(String runId, PriorAuthRequest request);

    /**
     * Records the reviewer's confirmation or override. Call {@link #run} afterwards to deliver the
     * outcome.
     */
    Mono<HumanDecisionRecord> recordHumanDecision(String runId, HumanDecisionRequest request);

    Flux<ReviewAuditEntry> getAuditTrail(String runId);

    /**
     * @return the latest checkpoint payload of the task, or empty if the task has none yet
     */
    <T> Mono<T> readCheckpoint(String runId, String taskId, Class<T> payloadType);

    Mono<TaskLedger> getLedger(String runId);

    IReviewSequencer getSequencer();
}
