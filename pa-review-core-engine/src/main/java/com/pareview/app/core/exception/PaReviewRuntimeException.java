package com.pareview.app.core.exception;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;
import com.pareview.app.integration.enumerations.ReviewErrorCategory;
import lombok.Getter;

import java.util.Map;

/**
 * Base of every error the review engine raises. The error info decides whether the failure
 * leaves a run resumable.
 */
@Getter
public class PaReviewRuntimeException extends RuntimeException {

    private final IPaReviewErrorInfo errorInfo;
    private final Map<String, String> templateVariables;

    public PaReviewRuntimeException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null);
    }

    public PaReviewRuntimeException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables, Throwable cause) {
        super(render(errorInfo, templateVariables), cause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables == null ? Map.of() : Map.copyOf(templateVariables);
    }

    public ReviewErrorCategory getCategory() {
        return errorInfo.getCategory();
    }

    public boolean isRecoverable() {
        return errorInfo.getCategory().isRecoverable();
    }

    public String getResolution() {
        return errorInfo.getResolutionTemplate();
    }

    private static String render(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables) {
        String message = errorInfo.getErrorTemplate();
        if (templateVariables != null) {
            for (Map.Entry<String, String> variable : templateVariables.entrySet()) {
                message = message.replace("{" + variable.getKey() + "}", String.valueOf(variable.getValue()));
            }
        }
        return "[" + errorInfo.getErrorCode() + "] " + message;
    }
}
