package com.pareview.app.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * Lifecycle of a single task within a run.
 *
 * <p>Status only moves forward: {@code NOT_STARTED -> IN_PROGRESS -> COMPLETED}.</p>
 */
@Getter
@AllArgsConstructor
public enum TaskStatus {

    NOT_STARTED("not-started"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed");

    private final String wireValue;

    @JsonValue
    public String toWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static TaskStatus fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + value));
    }

    /**
     * Checks whether a transition from this status to the target is a single forward step.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case NOT_STARTED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETED;
            case COMPLETED -> false;
        };
    }
}
