package com.pareview.app.integration.enumerations;

public enum RequirementLevel {
    MUST,
    SHOULD
}
