package com.pareview.app.core.exception;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;

import java.util.Map;

/**
 * Signals that a run stopped at a task that needs a reviewer.
 */
public class AwaitingHumanInputException extends PaReviewRuntimeException {

    public AwaitingHumanInputException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables) {
        super(errorInfo, templateVariables);
    }
}
