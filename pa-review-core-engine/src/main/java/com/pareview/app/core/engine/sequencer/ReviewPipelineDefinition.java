package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.core.exception.LedgerInvariantViolationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.constant.ReviewTaskIds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed total order of pipeline tasks, known before any run starts.
 */
public class ReviewPipelineDefinition {

    private final Map<String, IReviewTaskHandler> handlers;
    private final List<String> taskIds;

    private ReviewPipelineDefinition(Map<String, IReviewTaskHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(handlers);
        this.taskIds = List.copyOf(handlers.keySet());
    }

    /**
     * Builds a definition that runs the handlers in list order.
     *
     * @throws LedgerInvariantViolationException if the list is empty or ids are blank, reserved or repeated
     */
    public static ReviewPipelineDefinition of(List<IReviewTaskHandler> orderedHandlers) {
        if (orderedHandlers == null || orderedHandlers.isEmpty()) {
            throw invalid("at least one task is required");
        }
        Map<String, IReviewTaskHandler> byId = new LinkedHashMap<>();
        for (IReviewTaskHandler handler : orderedHandlers) {
            String taskId = handler.taskId();
            if (taskId == null || taskId.isBlank()) {
                throw invalid("task id must not be blank");
            }
            if (ReviewTaskIds.SUBMISSION.equals(taskId)) {
                throw invalid("task id '" + taskId + "' is reserved");
            }
            if (byId.putIfAbsent(taskId, handler) != null) {
                throw invalid("duplicate task id '" + taskId + "'");
            }
        }
        return new ReviewPipelineDefinition(byId);
    }

    public List<String> taskIds() {
        return taskIds;
    }

    public IReviewTaskHandler handler(String taskId) {
        IReviewTaskHandler handler = handlers.get(taskId);
        if (handler == null) {
            throw invalid("no handler for task '" + taskId + "'");
        }
        return handler;
    }

    /**
     * 1-based position of the task, or -1 when it is not part of the pipeline.
     */
    public int position(String taskId) {
        int index = taskIds.indexOf(taskId);
        return index < 0 ? -1 : index + 1;
    }

    public boolean isBefore(String candidate, String reference) {
        int candidatePosition = position(candidate);
        return candidatePosition > 0 && candidatePosition < position(reference);
    }

    public Optional<String> firstHumanInputTaskId() {
        return taskIds.stream()
                .filter(taskId -> handlers.get(taskId).requiresHumanInput())
                .findFirst();
    }

    private static LedgerInvariantViolationException invalid(String reason) {
        return new LedgerInvariantViolationException(PaReviewInternalErrorCodes.PIPELINE_DEFINITION_INVALID,
                Map.of("reason", reason));
    }
}
