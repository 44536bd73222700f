package com.pareview.app.core.exception;

import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

/**
 * Thrown when a run cannot be driven because another owner holds its lock.
 */
@Getter
public class RunLockedException extends PaReviewRuntimeException {

    private final String runId;
    private final String currentHolder;

    public RunLockedException(String runId) {
        this(runId, null);
    }

    public RunLockedException(String runId, String currentHolder) {
        super(PaReviewInternalErrorCodes.RUN_LOCKED, Map.of("runId", runId));
        this.runId = runId;
        this.currentHolder = currentHolder;
    }
}
