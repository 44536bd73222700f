package com.pareview.app.core.exception;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;
import lombok.Getter;

import java.util.Map;

/**
 * Wraps an unexpected failure of a task's domain logic. Leaves the task in progress.
 */
@Getter
public class TaskExecutionException extends PaReviewRuntimeException {

    private final String runId;
    private final String taskId;

    public TaskExecutionException(IPaReviewErrorInfo errorInfo, String runId, String taskId,
                                  Map<String, String> templateVariables, Throwable cause) {
        super(errorInfo, templateVariables, cause);
        this.runId = runId;
        this.taskId = taskId;
    }
}
