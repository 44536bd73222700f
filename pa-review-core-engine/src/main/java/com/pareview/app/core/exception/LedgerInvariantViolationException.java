package com.pareview.app.core.exception;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;

import java.util.Map;

/**
 * A task ledger or checkpoint invariant was broken. Never corrected silently.
 */
public class LedgerInvariantViolationException extends PaReviewRuntimeException {

    public LedgerInvariantViolationException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables) {
        super(errorInfo, templateVariables);
    }
}
