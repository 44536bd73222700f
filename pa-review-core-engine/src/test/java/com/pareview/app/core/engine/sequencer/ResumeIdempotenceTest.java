package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.ReviewFixtures;
import com.pareview.app.core.engine.audit.ReviewAuditAction;
import com.pareview.app.core.engine.audit.impl.InMemoryReviewAuditService;
import com.pareview.app.core.engine.checkpoint.impl.InMemoryCheckpointStore;
import com.pareview.app.core.engine.ledger.ITaskLedgerStore;
import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.ledger.impl.InMemoryTaskLedgerStore;
import com.pareview.app.core.engine.lock.impl.InMemoryRunLockService;
import com.pareview.app.integration.enumerations.RunStatus;
import com.pareview.app.integration.enumerations.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Crash between the checkpoint write and the ledger update, then recovery.
 */
class ResumeIdempotenceTest {

    private static final String RUN_ID = "run-crash";

    private CrashingLedgerStore ledgerStore;
    private InMemoryCheckpointStore checkpointStore;
    private InMemoryReviewAuditService auditService;
    private ScriptedTaskHandler intake;
    private ScriptedTaskHandler compliance;
    private ScriptedTaskHandler notify;
    private ReviewSequencer sequencer;

    @BeforeEach
    void setUp() {
        ledgerStore = new CrashingLedgerStore(new InMemoryTaskLedgerStore());
        checkpointStore = new InMemoryCheckpointStore();
        auditService = new InMemoryReviewAuditService();
        intake = new ScriptedTaskHandler("intake");
        compliance = new ScriptedTaskHandler("compliance");
        notify = new ScriptedTaskHandler("notify");
        sequencer = ReviewSequencer.builder()
                .pipeline(ReviewPipelineDefinition.of(List.of(intake, compliance, notify)))
                .ledgerStore(ledgerStore)
                .checkpointStore(checkpointStore)
                .auditService(auditService)
                .lockService(new InMemoryRunLockService())
                .build();
        sequencer.startRun(RUN_ID, ReviewFixtures.sampleRequest()).block();
    }

    @Test
    @DisplayName("resume completes a task whose checkpoint was written before the crash")
    void resumeReconcilesInterruptedCompletion() {
        // Given
        sequencer.advance(RUN_ID).block();
        ledgerStore.crashWhenCompleting("intake");

        // When
        assertThrows(IllegalStateException.class,
                () -> sequencer.complete(RUN_ID, "intake", Map.of("summary", "ok")).block());

        // Then
        assertEquals(TaskStatus.IN_PROGRESS, sequencer.getLedger(RUN_ID).block().requireTask("intake").getStatus());
        assertEquals(1, checkpointStore.findLatest(RUN_ID, "intake").block().getVersion());

        ResumeSummary summary = sequencer.resume(RUN_ID).block();

        assertEquals(1, summary.getCompletedCount());
        assertEquals("compliance", summary.getNextTaskId());
        assertEquals(TaskStatus.NOT_STARTED, summary.getNextTaskStatus());
        assertEquals(1, checkpointStore.listVersions(RUN_ID, "intake").collectList().block().size());
        assertEquals(1, auditService.countByAction(ReviewAuditAction.TASK_RECONCILED));
    }

    @Test
    @DisplayName("resuming twice changes nothing the second time")
    void resumeTwice() {
        sequencer.advance(RUN_ID).block();
        ledgerStore.crashWhenCompleting("intake");
        assertThrows(IllegalStateException.class, () -> sequencer.complete(RUN_ID, "intake", Map.of()).block());

        sequencer.resume(RUN_ID).block();
        TaskLedger afterFirst = sequencer.getLedger(RUN_ID).block();
        sequencer.resume(RUN_ID).block();
        TaskLedger afterSecond = sequencer.getLedger(RUN_ID).block();

        assertEquals(afterFirst.getRevision(), afterSecond.getRevision());
        assertEquals(afterFirst.getTasks(), afterSecond.getTasks());
        assertEquals(1, auditService.countByAction(ReviewAuditAction.TASK_RECONCILED));
    }

    @Test
    @DisplayName("driving the run again does not re-execute a task whose output survived the crash")
    void runAfterCrashSkipsReconciledTask() {
        ledgerStore.crashWhenCompleting("compliance");

        RunOutcome halted = sequencer.run(RUN_ID).block();

        assertEquals(RunOutcome.State.HALTED, halted.getState());
        assertEquals("compliance", halted.getTaskId());

        RunOutcome finished = sequencer.run(RUN_ID).block();

        assertEquals(RunOutcome.State.COMPLETED, finished.getState());
        assertEquals(RunStatus.COMPLETE, finished.getRunStatus());
        assertEquals(1, intake.getExecutions());
        assertEquals(1, compliance.getExecutions());
        assertEquals(1, notify.getExecutions());
        assertEquals(1, checkpointStore.listVersions(RUN_ID, "compliance").collectList().block().size());
    }

    @Test
    @DisplayName("an in-progress task without a checkpoint is left for re-execution")
    void noCheckpointNoReconcile() {
        sequencer.advance(RUN_ID).block();

        ResumeSummary summary = sequencer.resume(RUN_ID).block();

        assertEquals(0, summary.getCompletedCount());
        assertEquals("intake", summary.getNextTaskId());
        assertEquals(TaskStatus.IN_PROGRESS, summary.getNextTaskStatus());
        assertEquals(0, auditService.countByAction(ReviewAuditAction.TASK_RECONCILED));
    }

    /**
     * Fails the ledger save that would mark the armed task completed, once.
     */
    private static class CrashingLedgerStore implements ITaskLedgerStore {

        private final ITaskLedgerStore delegate;
        private volatile String crashTaskId;

        CrashingLedgerStore(ITaskLedgerStore delegate) {
            this.delegate = delegate;
        }

        void crashWhenCompleting(String taskId) {
            this.crashTaskId = taskId;
        }

        @Override
        public Mono<Void> initialize() {
            return delegate.initialize();
        }

        @Override
        public Mono<Void> shutdown() {
            return delegate.shutdown();
        }

        @Override
        public Mono<TaskLedger> create(TaskLedger ledger) {
            return delegate.create(ledger);
        }

        @Override
        public Mono<TaskLedger> findByRunId(String runId) {
            return delegate.findByRunId(runId);
        }

        @Override
        public Mono<TaskLedger> compareAndSave(TaskLedger updated, long expectedRevision) {
            String armed = crashTaskId;
            if (armed != null && updated.findTask(armed)
                    .map(task -> task.getStatus() == TaskStatus.COMPLETED)
                    .orElse(false)) {
                crashTaskId = null;
                return Mono.error(new IllegalStateException("simulated crash before ledger update"));
            }
            return delegate.compareAndSave(updated, expectedRevision);
        }

        @Override
        public Flux<TaskLedger> findAll() {
            return delegate.findAll();
        }

        @Override
        public Flux<TaskLedger> findByStatus(RunStatus status) {
            return delegate.findByStatus(status);
        }
    }
}
