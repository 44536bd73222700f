package com.pareview.app.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * Ordered gates of the decision resolver.
 */
@Getter
@AllArgsConstructor
public enum DecisionGate {
    PROVIDER("provider", "credentialing"),
    CODES("codes", "code clarification"),
    POLICY("policy", "policy review"),
    CRITERIA("criteria", "clinical criteria"),
    CONFIDENCE("confidence", "low confidence");

    private final String gateId;
    private final String reason;

    @JsonValue
    public String toWireValue() {
        return gateId;
    }

    @JsonCreator
    public static DecisionGate fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(gate -> gate.gateId.equalsIgnoreCase(value) || gate.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown decision gate: " + value));
    }
}
