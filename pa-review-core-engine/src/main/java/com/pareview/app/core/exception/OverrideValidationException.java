package com.pareview.app.core.exception;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * A reviewer decision was rejected. The candidate decision and the ledger are left untouched.
 */
@Getter
public class OverrideValidationException extends PaReviewRuntimeException {

    private final List<ReviewConstraintViolation> violations;

    public OverrideValidationException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, List.of());
    }

    public OverrideValidationException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables,
                                       List<ReviewConstraintViolation> violations) {
        super(errorInfo, templateVariables);
        this.violations = List.copyOf(violations);
    }
}
