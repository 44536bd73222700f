package com.pareview.app.core.exception;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;

import java.util.Map;

/**
 * Engine configuration rejected at load.
 */
public class ReviewConfigurationException extends PaReviewRuntimeException {

    public ReviewConfigurationException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables) {
        super(errorInfo, templateVariables);
    }
}
