package com.pareview.app.integration.enumerations;

public enum ReviewStoreType {
    MEMORY,
    FILE
}
