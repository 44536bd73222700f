package com.pareview.app.core.exception;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Malformed or missing case data. Fails the current task without advancing the ledger.
 */
@Getter
public class CaseInputException extends PaReviewRuntimeException {

    private final List<ReviewConstraintViolation> violations;

    public CaseInputException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, List.of());
    }

    public CaseInputException(IPaReviewErrorInfo errorInfo, Map<String, String> templateVariables,
                              List<ReviewConstraintViolation> violations) {
        super(errorInfo, templateVariables);
        this.violations = List.copyOf(violations);
    }

    /**
     * Names of the offending fields, in the order they were reported.
     */
    public List<String> getFields() {
        return violations.stream().map(ReviewConstraintViolation::field).toList();
    }
}
