package com.pareview.app.integration.models.decision;

import com.pareview.app.integration.enumerations.DecisionGate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DecisionGap {

    private String description;

    private DecisionGate gate;

    private boolean critical;

    public static DecisionGap critical(DecisionGate gate, String description) {
        return new DecisionGap(description, gate, true);
    }

    public static DecisionGap advisory(DecisionGate gate, String description) {
        return new DecisionGap(description, gate, false);
    }
}
