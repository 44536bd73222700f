package com.pareview.app.core.engine.ledger;

import com.pareview.app.core.exception.LedgerInvariantViolationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.RunStatus;
import com.pareview.app.integration.enumerations.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskLedgerTest {

    private static final Instant T0 = Instant.parse("2026-01-05T08:00:00Z");
    private static final Instant T1 = T0.plusSeconds(30);

    private static TaskLedger ledger() {
        return TaskLedger.create("run-1", "CASE-1", List.of("a", "b", "c"), T0);
    }

    @Nested
    @DisplayName("Creation and lookup")
    class CreationTests {

        @Test
        @DisplayName("a new ledger lists every task not started, in order")
        void create() {
            TaskLedger ledger = ledger();

            assertEquals(RunStatus.INITIALIZED, ledger.getStatus());
            assertEquals(0, ledger.getRevision());
            assertEquals("a", ledger.getCurrentTaskId());
            assertEquals(List.of(1, 2, 3), ledger.getTasks().stream().map(TaskRecord::getPosition).toList());
            assertEquals(3, ledger.countTasks(TaskStatus.NOT_STARTED));
            assertDoesNotThrow(ledger::validateInvariants);
        }

        @Test
        @DisplayName("unknown task ids are rejected")
        void unknownTask() {
            LedgerInvariantViolationException error = assertThrows(LedgerInvariantViolationException.class,
                    () -> ledger().requireTask("z"));

            assertEquals(PaReviewInternalErrorCodes.LEDGER_UNKNOWN_TASK, error.getErrorInfo());
            assertFalse(error.isRecoverable());
        }
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("start and complete set their timestamps once")
        void startThenComplete() {
            TaskRecord started = TaskRecord.notStarted("a", 1).start("run-1", T0);
            TaskRecord completed = started.complete("run-1", T1);

            assertEquals(TaskStatus.IN_PROGRESS, started.getStatus());
            assertEquals(T0, started.getStartedAt());
            assertNull(started.getCompletedAt());
            assertEquals(TaskStatus.COMPLETED, completed.getStatus());
            assertEquals(T0, completed.getStartedAt());
            assertEquals(T1, completed.getCompletedAt());
        }

        @Test
        @DisplayName("skipping in progress is rejected")
        void skipRejected() {
            LedgerInvariantViolationException error = assertThrows(LedgerInvariantViolationException.class,
                    () -> TaskRecord.notStarted("a", 1).complete("run-1", T0));

            assertEquals(PaReviewInternalErrorCodes.LEDGER_ILLEGAL_TRANSITION, error.getErrorInfo());
        }

        @Test
        @DisplayName("a completed task cannot start again")
        void backwardRejected() {
            TaskRecord completed = TaskRecord.notStarted("a", 1).start("run-1", T0).complete("run-1", T1);

            assertThrows(LedgerInvariantViolationException.class, () -> completed.start("run-1", T1));
        }

        @Test
        @DisplayName("withTask replaces one record and moves the current task")
        void withTask() {
            TaskLedger ledger = ledger();
            TaskRecord a = ledger.requireTask("a").start("run-1", T0).complete("run-1", T1);

            TaskLedger updated = ledger.withTask(a, T1);

            assertEquals("b", updated.getCurrentTaskId());
            assertEquals(T1, updated.getUpdatedAt());
            assertEquals(TaskStatus.NOT_STARTED, ledger.requireTask("a").getStatus());
        }
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("two tasks in progress is a violation")
        void twoInProgress() {
            TaskLedger ledger = ledger();
            ledger = ledger.withTask(ledger.requireTask("a").start("run-1", T0), T0);
            ledger = ledger.withTask(ledger.requireTask("b").start("run-1", T0), T0);

            LedgerInvariantViolationException error = assertThrows(LedgerInvariantViolationException.class,
                    ledger::validateInvariants);

            assertEquals(PaReviewInternalErrorCodes.LEDGER_MULTIPLE_IN_PROGRESS, error.getErrorInfo());
        }

        @Test
        @DisplayName("a task started ahead of an unfinished one is a violation")
        void outOfOrder() {
            TaskLedger ledger = ledger();
            ledger = ledger.withTask(ledger.requireTask("b").start("run-1", T0), T0);

            LedgerInvariantViolationException error = assertThrows(LedgerInvariantViolationException.class,
                    ledger::validateInvariants);

            assertEquals(PaReviewInternalErrorCodes.LEDGER_ORDER_VIOLATION, error.getErrorInfo());
        }

        @Test
        @DisplayName("completed prefix, one in progress, the rest not started is valid")
        void validShape() {
            TaskLedger ledger = ledger();
            ledger = ledger.withTask(ledger.requireTask("a").start("run-1", T0).complete("run-1", T1), T1);
            ledger = ledger.withTask(ledger.requireTask("b").start("run-1", T1), T1);

            assertDoesNotThrow(ledger::validateInvariants);
            assertEquals("b", ledger.getCurrentTaskId());
            assertFalse(ledger.allTasksCompleted());
        }
    }
}
