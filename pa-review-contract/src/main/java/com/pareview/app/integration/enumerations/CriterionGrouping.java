package com.pareview.app.integration.enumerations;

/**
 * How the members of a criterion group combine into one group verdict.
 */
public enum CriterionGrouping {
    /** Group is met only if every member is met. */
    ALL,
    /** Group is met if at least one member is met. */
    ANY
}
