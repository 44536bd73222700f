package com.pareview.app.core.exception;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;

import java.util.Map;

/**
 * Resolver configured to emit an outcome it is not permitted to emit.
 */
public class DecisionPolicyException extends PaReviewRuntimeException {

    public DecisionPolicyException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables) {
        super(errorInfo, templateVariables);
    }
}
