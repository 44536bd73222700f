package com.pareview.app.core.engine.ledger;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.pareview.app.core.exception.LedgerInvariantViolationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle entry of one task in a run's ledger.
 *
 * <p>{@code startedAt} and {@code completedAt} are each set exactly once, by {@link #start} and
 * {@link #complete}. Both return a new record; any backward or skipping transition is rejected.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskRecord {

    private String id;

    private int position;

    private TaskStatus status;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant startedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant completedAt;

    public static TaskRecord notStarted(String id, int position) {
        return TaskRecord.builder()
                .id(id)
                .position(position)
                .status(TaskStatus.NOT_STARTED)
                .build();
    }

    public TaskRecord start(String runId, Instant at) {
        requireTransition(runId, TaskStatus.IN_PROGRESS);
        return toBuilder()
                .status(TaskStatus.IN_PROGRESS)
                .startedAt(at)
                .build();
    }

    public TaskRecord complete(String runId, Instant at) {
        requireTransition(runId, TaskStatus.COMPLETED);
        return toBuilder()
                .status(TaskStatus.COMPLETED)
                .completedAt(at)
                .build();
    }

    private void requireTransition(String runId, TaskStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new LedgerInvariantViolationException(PaReviewInternalErrorCodes.LEDGER_ILLEGAL_TRANSITION, Map.of(
                    "runId", String.valueOf(runId),
                    "taskId", String.valueOf(id),
                    "from", String.valueOf(status),
                    "to", target.name()));
        }
    }
}
