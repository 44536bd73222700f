package com.pareview.app.integration.enumerations;

public enum ReviewActorType {
    SYSTEM,
    REVIEWER,
    OPERATOR
}
