package com.pareview.app.core.engine.ledger;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.pareview.app.core.exception.LedgerInvariantViolationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.RunStatus;
import com.pareview.app.integration.enumerations.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-run ledger: the run header plus one {@link TaskRecord} per pipeline task.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one task is {@code in-progress}</li>
 *   <li>In pipeline order, completed tasks form a prefix, followed by at most one in-progress
 *       task, followed only by not-started tasks</li>
 * </ul>
 *
 * <p>{@code revision} increases by one on every successful save and backs the store's
 * compare-and-set. {@code currentTaskId} is the first task that is not completed, or null once
 * every task is done.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskLedger {

    private String runId;

    private String caseId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant updatedAt;

    private RunStatus status;

    private String currentTaskId;

    private long revision;

    private List<TaskRecord> tasks;

    public static TaskLedger create(String runId, String caseId, List<String> taskIds, Instant now) {
        List<TaskRecord> records = new ArrayList<>();
        for (int i = 0; i < taskIds.size(); i++) {
            records.add(TaskRecord.notStarted(taskIds.get(i), i + 1));
        }
        return TaskLedger.builder()
                .runId(runId)
                .caseId(caseId)
                .createdAt(now)
                .updatedAt(now)
                .status(RunStatus.INITIALIZED)
                .currentTaskId(taskIds.isEmpty() ? null : taskIds.get(0))
                .revision(0)
                .tasks(records)
                .build();
    }

    public Optional<TaskRecord> findTask(String taskId) {
        return orderedTasks().stream()
                .filter(task -> task.getId().equals(taskId))
                .findFirst();
    }

    public TaskRecord requireTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> new LedgerInvariantViolationException(
                PaReviewInternalErrorCodes.LEDGER_UNKNOWN_TASK,
                Map.of("runId", String.valueOf(runId), "taskId", String.valueOf(taskId))));
    }

    /**
     * First task in pipeline order whose status is not completed.
     */
    public Optional<TaskRecord> firstIncomplete() {
        return orderedTasks().stream()
                .filter(task -> task.getStatus() != TaskStatus.COMPLETED)
                .findFirst();
    }

    public long countTasks(TaskStatus status) {
        return orderedTasks().stream().filter(task -> task.getStatus() == status).count();
    }

    public boolean allTasksCompleted() {
        return firstIncomplete().isEmpty();
    }

    /**
     * Returns a copy with the given task record replaced and {@code currentTaskId} recomputed.
     * The status is left for the caller to resolve.
     */
    public TaskLedger withTask(TaskRecord updated, Instant now) {
        requireTask(updated.getId());
        List<TaskRecord> replaced = orderedTasks().stream()
                .map(task -> task.getId().equals(updated.getId()) ? updated : task)
                .collect(Collectors.toCollection(ArrayList::new));
        TaskLedger copy = toBuilder()
                .tasks(replaced)
                .updatedAt(now)
                .build();
        copy.setCurrentTaskId(copy.firstIncomplete().map(TaskRecord::getId).orElse(null));
        return copy;
    }

    /**
     * Checks the ledger invariants and throws on the first violation.
     */
    public void validateInvariants() {
        List<TaskRecord> ordered = orderedTasks();
        List<String> inProgress = ordered.stream()
                .filter(task -> task.getStatus() == TaskStatus.IN_PROGRESS)
                .map(TaskRecord::getId)
                .toList();
        if (inProgress.size() > 1) {
            throw new LedgerInvariantViolationException(PaReviewInternalErrorCodes.LEDGER_MULTIPLE_IN_PROGRESS,
                    Map.of("runId", String.valueOf(runId), "tasks", String.join(",", inProgress)));
        }

        // COMPLETED* IN_PROGRESS? NOT_STARTED*
        TaskStatus floor = TaskStatus.COMPLETED;
        for (TaskRecord task : ordered) {
            TaskStatus status = task.getStatus();
            if (status == null || rank(status) > rank(floor)) {
                throw new LedgerInvariantViolationException(PaReviewInternalErrorCodes.LEDGER_ORDER_VIOLATION, Map.of(
                        "runId", String.valueOf(runId),
                        "taskId", String.valueOf(task.getId()),
                        "status", String.valueOf(status)));
            }
            if (status != TaskStatus.COMPLETED) {
                floor = TaskStatus.NOT_STARTED;
            }
        }
    }

    private static int rank(TaskStatus status) {
        return switch (status) {
            case NOT_STARTED -> 0;
            case IN_PROGRESS -> 1;
            case COMPLETED -> 2;
        };
    }

    private List<TaskRecord> orderedTasks() {
        if (tasks == null) {
            return List.of();
        }
        return tasks.stream()
                .sorted(Comparator.comparingInt(TaskRecord::getPosition))
                .toList();
    }
}
