package com.pareview.app.core.exception;

/**
 * One failed field constraint, addressed by its property path.
 */
public record ReviewConstraintViolation(String field, String message) {

    @Override
    public String toString() {
        return field + " " + message;
    }
}
