package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.audit.IReviewAuditService;
import com.pareview.app.core.engine.audit.ReviewAuditEntry;
import com.pareview.app.core.engine.checkpoint.Checkpoint;
import com.pareview.app.core.engine.checkpoint.ICheckpointStore;
import com.pareview.app.core.engine.ledger.ITaskLedgerStore;
import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.ledger.TaskRecord;
import com.pareview.app.core.engine.lock.IReviewRunLockService;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.core.exception.AwaitingHumanInputException;
import com.pareview.app.core.exception.CaseInputException;
import com.pareview.app.core.exception.PaReviewRuntimeException;
import com.pareview.app.core.exception.RunNotFoundException;
import com.pareview.app.core.exception.TaskExecutionException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.enumerations.RunStatus;
import com.pareview.app.integration.enumerations.TaskStatus;
import com.pareview.app.integration.exception.CollaboratorUnavailableException;
import com.pareview.app.integration.models.request.PriorAuthRequest;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Default sequencer over a ledger store and a checkpoint store.
 *
 * <p>Every ledger write is a compare-and-set against the revision that was read, so two callers
 * racing on the same run can never both move a task forward. {@link #run} additionally holds the
 * run lock for the whole drive.</p>
 */
@Slf4j
public class ReviewSequencer implements IReviewSequencer {

    private final ReviewPipelineDefinition pipeline;
    private final ITaskLedgerStore ledgerStore;
    private final ICheckpointStore checkpointStore;
    private final IReviewAuditService auditService;
    private final IReviewRunLockService lockService;
    private final Duration taskTimeout;
    private final Duration lockDuration;
    private final Clock clock;
    private final ReviewObjectMapper mapper = ReviewObjectMapper.getInstance();

    @Builder
    public ReviewSequencer(ReviewPipelineDefinition pipeline,
                           ITaskLedgerStore ledgerStore,
                           ICheckpointStore checkpointStore,
                           IReviewAuditService auditService,
                           IReviewRunLockService lockService,
                           Duration taskTimeout,
                           Duration lockDuration,
                           Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.ledgerStore = Objects.requireNonNull(ledgerStore, "ledgerStore");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.auditService = Objects.requireNonNull(auditService, "auditService");
        this.lockService = Objects.requireNonNull(lockService, "lockService");
        this.taskTimeout = taskTimeout;
        this.lockDuration = lockDuration != null ? lockDuration : Duration.ofMinutes(5);
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    // ========================================================================
    // RUN LIFECYCLE
    // ========================================================================

    @Override
    public Mono<TaskLedger> startRun(String runId, PriorAuthRequest submission) {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(submission, "submission");
        return Mono.defer(() -> {
            TaskLedger ledger = TaskLedger.create(runId, submission.getCaseId(), pipeline.taskIds(), clock.instant());
            return ledgerStore.create(ledger)
                    .flatMap(created -> checkpointStore.write(runId, ReviewTaskIds.SUBMISSION, mapper.valueToTree(submission))
                            .then(audit(ReviewAuditEntry.runCreated(runId, created.getCaseId(), created.getTasks().size())))
                            .thenReturn(created))
                    .doOnNext(created -> log.info("Run started: runId={}, caseId={}, tasks={}",
                            runId, created.getCaseId(), pipeline.taskIds()));
        });
    }

    @Override
    public Mono<TaskLedger> amendSubmission(String runId, PriorAuthRequest submission) {
        Objects.requireNonNull(submission, "submission");
        return loadLedger(runId).flatMap(ledger -> {
            Optional<String> reader = pipeline.taskIds().stream()
                    .filter(taskId -> pipeline.handler(taskId).readsSubmission())
                    .findFirst();
            Optional<TaskStatus> readerStatus = reader.flatMap(ledger::findTask).map(TaskRecord::getStatus);
            if (readerStatus.isPresent() && readerStatus.get() == TaskStatus.COMPLETED) {
                return Mono.error(new CaseInputException(PaReviewInternalErrorCodes.CASE_SUBMISSION_LOCKED,
                        Map.of("runId", runId, "status", readerStatus.get().toWireValue())));
            }
            return checkpointStore.write(runId, ReviewTaskIds.SUBMISSION, mapper.valueToTree(submission))
                    .flatMap(checkpoint -> audit(ReviewAuditEntry.submissionAmended(
                            runId, ledger.getCaseId(), checkpoint.getVersion())))
                    .doOnNext(entry -> log.info("Submission amended: runId={}", runId))
                    .thenReturn(ledger);
        });
    }

    @Override
    public Mono<TaskLedger> getLedger(String runId) {
        return loadLedger(runId);
    }

    // ========================================================================
    // ADVANCE / COMPLETE / RESUME
    // ========================================================================

    @Override
    public Mono<TaskRecord> advance(String runId) {
        return advanceTask(runId).map(ActiveTask::task);
    }

    private Mono<ActiveTask> advanceTask(String runId) {
        return reconcile(runId).flatMap(ledger -> {
            Optional<TaskRecord> next = ledger.firstIncomplete();
            if (next.isEmpty()) {
                return Mono.empty();
            }
            TaskRecord task = next.get();
            if (task.getStatus() == TaskStatus.IN_PROGRESS) {
                log.info("Re-entering in-progress task: runId={}, taskId={}", runId, task.getId());
                return Mono.just(new ActiveTask(ledger, task));
            }
            Instant now = clock.instant();
            TaskRecord started = task.start(runId, now);
            return save(ledger, ledger.withTask(started, now))
                    .flatMap(saved -> audit(ReviewAuditEntry.taskStarted(runId, saved.getCaseId(), started.getId()))
                            .thenReturn(new ActiveTask(saved, started)))
                    .doOnNext(active -> log.info("Task started: runId={}, taskId={}, position={}",
                            runId, started.getId(), started.getPosition()));
        });
    }

    @Override
    public Mono<TaskLedger> complete(String runId, String taskId, Object payload) {
        Objects.requireNonNull(payload, "payload");
        return loadLedger(runId).flatMap(ledger -> {
            TaskRecord task = ledger.requireTask(taskId);
            // Reject before writing anything
            task.complete(runId, clock.instant());
            return checkpointStore.write(runId, taskId, mapper.valueToTree(payload))
                    .flatMap(checkpoint -> {
                        Instant now = clock.instant();
                        return save(ledger, ledger.withTask(task.complete(runId, now), now))
                                .flatMap(saved -> audit(ReviewAuditEntry.taskCompleted(
                                        runId, saved.getCaseId(), taskId, checkpoint.getVersion()))
                                        .then(auditRunCompletion(saved))
                                        .thenReturn(saved))
                                .doOnNext(saved -> log.info("Task completed: runId={}, taskId={}, checkpointVersion={}, runStatus={}",
                                        runId, taskId, checkpoint.getVersion(), saved.getStatus().toWireValue()));
                    });
        });
    }

    @Override
    public Mono<ResumeSummary> resume(String runId) {
        return reconcile(runId)
                .map(ResumeSummary::from)
                .flatMap(summary -> audit(ReviewAuditEntry.runResumed(runId, summary.getCaseId(),
                        summary.getNextTaskId(), summary.getCompletedCount(), summary.getRemainingCount()))
                        .thenReturn(summary))
                .doOnNext(summary -> log.info("Run resumed: runId={}, completed={}, remaining={}, next={}",
                        runId, summary.getCompletedCount(), summary.getRemainingCount(), summary.getNextTaskId()));
    }

    /**
     * Marks an in-progress task completed when a checkpoint written since it started already
     * exists, then repeats for the next task.
     */
    private Mono<TaskLedger> reconcile(String runId) {
        return loadLedger(runId).flatMap(this::reconcileLedger);
    }

    private Mono<TaskLedger> reconcileLedger(TaskLedger ledger) {
        Optional<TaskRecord> next = ledger.firstIncomplete();
        if (next.isEmpty() || next.get().getStatus() != TaskStatus.IN_PROGRESS) {
            return Mono.just(ledger);
        }
        TaskRecord task = next.get();
        String runId = ledger.getRunId();
        return checkpointStore.findLatest(runId, task.getId())
                .filter(checkpoint -> writtenSinceStart(checkpoint, task))
                .flatMap(checkpoint -> {
                    Instant now = clock.instant();
                    log.warn("Reconciling interrupted completion: runId={}, taskId={}, checkpointVersion={}",
                            runId, task.getId(), checkpoint.getVersion());
                    Mono<TaskLedger> reconciled = save(ledger, ledger.withTask(task.complete(runId, now), now))
                            .flatMap(saved -> audit(ReviewAuditEntry.taskReconciled(
                                    runId, saved.getCaseId(), task.getId(), checkpoint.getVersion()))
                                    .then(auditRunCompletion(saved))
                                    .thenReturn(saved));
                    return reconciled.flatMap(this::reconcileLedger);
                })
                .switchIfEmpty(Mono.just(ledger));
    }

    private static boolean writtenSinceStart(Checkpoint checkpoint, TaskRecord task) {
        return task.getStartedAt() != null
                && checkpoint.getWrittenAt() != null
                && !checkpoint.getWrittenAt().isBefore(task.getStartedAt());
    }

    // ========================================================================
    // DRIVING
    // ========================================================================

    @Override
    public Mono<RunOutcome> run(String runId) {
        String ownerId = "sequencer-" + UUID.randomUUID();
        return lockService.executeWithLock(runId, ownerId, lockDuration, "run", () -> drive(runId));
    }

    private Mono<RunOutcome> drive(String runId) {
        return advanceTask(runId)
                .flatMap(active -> executeTask(runId, active))
                .switchIfEmpty(Mono.defer(() -> loadLedger(runId).map(RunOutcome::completed)));
    }

    /**
     * Runs one task. Success continues with the next task; a recoverable failure ends the drive
     * with an outcome; a fatal failure propagates.
     */
    private Mono<RunOutcome> executeTask(String runId, ActiveTask active) {
        TaskRecord task = active.task();
        IReviewTaskHandler handler = pipeline.handler(task.getId());
        ReviewTaskContext context = new ReviewTaskContext(runId, active.ledger().getCaseId(), task.getId(),
                handler.readsSubmission(), pipeline, checkpointStore);

        Mono<Object> work = Mono.defer(() -> handler.execute(context));
        if (taskTimeout != null) {
            work = work.timeout(taskTimeout);
        }
        Mono<RunOutcome> attempt = work
                .switchIfEmpty(Mono.error(() -> new TaskExecutionException(PaReviewInternalErrorCodes.TASK_EXECUTION_FAILED,
                        runId, task.getId(), Map.of("runId", runId, "taskId", task.getId(),
                        "reason", "task produced no payload"), null)))
                .flatMap(payload -> complete(runId, task.getId(), payload))
                .then(Mono.<RunOutcome>empty())
                .onErrorResume(error -> handleFailure(active.ledger(), task, error));
        return attempt.switchIfEmpty(Mono.defer(() -> drive(runId)));
    }

    private Mono<RunOutcome> handleFailure(TaskLedger ledger, TaskRecord task, Throwable error) {
        String runId = ledger.getRunId();
        String caseId = ledger.getCaseId();
        Throwable cause = Exceptions.unwrap(error);

        if (cause instanceof AwaitingHumanInputException) {
            log.info("Run waiting for reviewer: runId={}, taskId={}", runId, task.getId());
            return audit(ReviewAuditEntry.awaitingReview(runId, caseId, task.getId()))
                    .then(loadLedger(runId))
                    .map(current -> RunOutcome.awaitingHumanInput(current, task.getId()));
        }

        PaReviewRuntimeException classified = classify(runId, task.getId(), cause);
        Mono<ReviewAuditEntry> failed = audit(ReviewAuditEntry.taskFailed(runId, caseId, task.getId(),
                classified.getCategory().name(), classified.getMessage()));
        if (!classified.isRecoverable()) {
            log.error("Fatal error, aborting run: runId={}, taskId={}, error={}", runId, task.getId(), classified.getMessage());
            return failed.then(Mono.<RunOutcome>error(classified));
        }
        log.warn("Task failed, run halted: runId={}, taskId={}, category={}, error={}",
                runId, task.getId(), classified.getCategory(), classified.getMessage());
        return failed
                .then(audit(ReviewAuditEntry.runHalted(runId, caseId, task.getId())))
                .then(loadLedger(runId))
                .map(current -> RunOutcome.halted(current, task.getId(), classified));
    }

    private PaReviewRuntimeException classify(String runId, String taskId, Throwable cause) {
        if (cause instanceof PaReviewRuntimeException reviewError) {
            return reviewError;
        }
        if (cause instanceof TimeoutException) {
            return new TaskExecutionException(PaReviewInternalErrorCodes.TASK_TIMED_OUT, runId, taskId,
                    Map.of("runId", runId, "taskId", taskId, "timeout", String.valueOf(taskTimeout)), cause);
        }
        if (cause instanceof CollaboratorUnavailableException unavailable) {
            return new TaskExecutionException(PaReviewInternalErrorCodes.COLLABORATOR_UNAVAILABLE, runId, taskId,
                    Map.of("collaborator", unavailable.getCollaborator(), "taskId", taskId,
                            "reason", String.valueOf(unavailable.getMessage())), cause);
        }
        return new TaskExecutionException(PaReviewInternalErrorCodes.TASK_EXECUTION_FAILED, runId, taskId,
                Map.of("runId", runId, "taskId", taskId, "reason", String.valueOf(cause)), cause);
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private Mono<TaskLedger> loadLedger(String runId) {
        return ledgerStore.findByRunId(runId)
                .switchIfEmpty(Mono.error(() -> new RunNotFoundException(runId)))
                .doOnNext(TaskLedger::validateInvariants);
    }

    private Mono<TaskLedger> save(TaskLedger current, TaskLedger updated) {
        updated.setStatus(RunStatusResolver.resolve(updated, pipeline));
        return ledgerStore.compareAndSave(updated, current.getRevision());
    }

    private Mono<Void> auditRunCompletion(TaskLedger ledger) {
        if (ledger.getStatus() != RunStatus.COMPLETE) {
            return Mono.empty();
        }
        log.info("Run complete: runId={}, caseId={}", ledger.getRunId(), ledger.getCaseId());
        return audit(ReviewAuditEntry.runCompleted(ledger.getRunId(), ledger.getCaseId())).then();
    }

    private Mono<ReviewAuditEntry> audit(ReviewAuditEntry entry) {
        return auditService.record(entry);
    }

    private record ActiveTask(TaskLedger ledger, TaskRecord task) {
    }
}
