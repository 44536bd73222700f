package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.ledger.TaskRecord;
import com.pareview.app.integration.enumerations.RunStatus;
import com.pareview.app.integration.enumerations.TaskStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Progress of a run as seen on resumption.
 */
@Getter
@Builder
@ToString
public class ResumeSummary {

    private final String runId;
    private final String caseId;
    private final RunStatus status;
    private final long completedCount;
    private final long remainingCount;
    private final String nextTaskId;
    private final TaskStatus nextTaskStatus;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String lastCompletedTaskId;
    private final Instant lastCompletedAt;
    private final List<TaskRecord> tasks;

    public static ResumeSummary from(TaskLedger ledger) {
        Optional<TaskRecord> next = ledger.firstIncomplete();
        Optional<TaskRecord> lastCompleted = ledger.getTasks().stream()
                .filter(task -> task.getStatus() == TaskStatus.COMPLETED)
                .max(Comparator.comparingInt(TaskRecord::getPosition));
        long completed = ledger.countTasks(TaskStatus.COMPLETED);
        return ResumeSummary.builder()
                .runId(ledger.getRunId())
                .caseId(ledger.getCaseId())
                .status(ledger.getStatus())
                .completedCount(completed)
                .remainingCount(ledger.getTasks().size() - completed)
                .nextTaskId(next.map(TaskRecord::getId).orElse(null))
                .nextTaskStatus(next.map(TaskRecord::getStatus).orElse(null))
                .createdAt(ledger.getCreatedAt())
                .updatedAt(ledger.getUpdatedAt())
                .lastCompletedTaskId(lastCompleted.map(TaskRecord::getId).orElse(null))
                .lastCompletedAt(lastCompleted.map(TaskRecord::getCompletedAt).orElse(null))
                .tasks(ledger.getTasks().stream()
                        .sorted(Comparator.comparingInt(TaskRecord::getPosition))
                        .toList())
                .build();
    }

    public boolean isFinished() {
        return nextTaskId == null;
    }

    /**
     * Multi-line progress report for operators.
     */
    public String describe() {
        StringBuilder text = new StringBuilder()
                .append("Run ").append(runId).append(" (case ").append(caseId).append("): ")
                .append(status.toWireValue()).append('\n')
                .append("  ").append(completedCount).append(" of ").append(completedCount + remainingCount)
                .append(" tasks completed, ").append(remainingCount).append(" remaining\n")
                .append("  created ").append(createdAt).append(", last updated ").append(updatedAt).append('\n');
        if (lastCompletedTaskId != null) {
            text.append("  last completed: ").append(lastCompletedTaskId).append(" at ").append(lastCompletedAt).append('\n');
        }
        text.append(nextTaskId == null
                ? "  nothing left to run\n"
                : "  next: " + nextTaskId + " (" + nextTaskStatus.toWireValue() + ")\n");
        for (TaskRecord task : tasks) {
            text.append("    ").append(task.getPosition()).append(". ").append(task.getId())
                    .append(" [").append(task.getStatus().toWireValue()).append(']');
            if (task.getStartedAt() != null) {
                text.append(" started ").append(task.getStartedAt());
            }
            if (task.getCompletedAt() != null) {
                text.append(" completed ").append(task.getCompletedAt());
            }
            text.append('\n');
        }
        return text.toString();
    }
}
