package com.pareview.app.integration.enumerations;

public enum CriterionVerdict {
    /** At least one supporting fact with provenance. */
    MET,
    /** An explicit contradicting fact or a documented absence. */
    NOT_MET,
    /** Evidence was sought but neither of the above holds. */
    INSUFFICIENT
}
