package com.pareview.app.core.exception;

import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class RunNotFoundException extends PaReviewRuntimeException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super(PaReviewInternalErrorCodes.RUN_NOT_FOUND, Map.of("runId", runId));
        this.runId = runId;
    }
}
