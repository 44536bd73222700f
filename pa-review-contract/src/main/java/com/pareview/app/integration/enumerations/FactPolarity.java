package com.pareview.app.integration.enumerations;

public enum FactPolarity {
    SUPPORTING,
    CONTRADICTING,
    /** The record states that something was looked for and is absent. */
    DOCUMENTED_ABSENCE
}
