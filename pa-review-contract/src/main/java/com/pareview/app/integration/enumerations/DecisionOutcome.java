package com.pareview.app.integration.enumerations;

/**
 * Outcomes a decision may carry. Every outcome is a candidate until a reviewer confirms it.
 */
public enum DecisionOutcome {
    APPROVE_CANDIDATE,
    PEND,
    DENY_CANDIDATE;

    public boolean isDenyType() {
        return this == DENY_CANDIDATE;
    }
}
