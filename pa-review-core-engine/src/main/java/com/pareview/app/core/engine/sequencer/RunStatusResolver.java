package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.ledger.TaskRecord;
import com.pareview.app.integration.enumerations.RunStatus;
import com.pareview.app.integration.enumerations.TaskStatus;

import java.util.Optional;

/**
 * Derives a run's status from its task records.
 *
 * <ul>
 *   <li>{@code complete}: every task completed</li>
 *   <li>{@code sections_complete}: every task before the first reviewer task completed, that task not yet</li>
 *   <li>{@code in_progress}: any task started</li>
 *   <li>{@code initialized}: nothing started</li>
 * </ul>
 */
public final class RunStatusResolver {

    private RunStatusResolver() {
    }

    public static RunStatus resolve(TaskLedger ledger, ReviewPipelineDefinition pipeline) {
        if (ledger.allTasksCompleted()) {
            return RunStatus.COMPLETE;
        }
        Optional<String> humanTaskId = pipeline.firstHumanInputTaskId();
        if (humanTaskId.isPresent()) {
            Optional<TaskRecord> humanTask = ledger.findTask(humanTaskId.get());
            if (humanTask.isPresent() && humanTask.get().getStatus() != TaskStatus.COMPLETED
                    && automatedSectionsComplete(ledger, humanTask.get())) {
                return RunStatus.SECTIONS_COMPLETE;
            }
        }
        boolean anyStarted = ledger.getTasks().stream()
                .anyMatch(task -> task.getStatus() != TaskStatus.NOT_STARTED);
        return anyStarted ? RunStatus.IN_PROGRESS : RunStatus.INITIALIZED;
    }

    private static boolean automatedSectionsComplete(TaskLedger ledger, TaskRecord humanTask) {
        return ledger.getTasks().stream()
                .filter(task -> task.getPosition() < humanTask.getPosition())
                .allMatch(task -> task.getStatus() == TaskStatus.COMPLETED);
    }
}
