package com.pareview.app.integration.models.decision;

import com.pareview.app.integration.enumerations.ConfidenceTier;
import com.pareview.app.integration.enumerations.DecisionGate;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Candidate outcome of the decision resolver.
 *
 * <p>{@code evaluatedGates} lists the gates actually reached, in order, so a reader can see where
 * evaluation stopped. {@code flagged} marks an approval reached on medium confidence.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Decision {

    private DecisionOutcome outcome;

    private double overallConfidence;

    private ConfidenceTier confidenceTier;

    private List<DecisionGap> gaps;

    private String rationale;

    private boolean flagged;

    private List<String> flags;

    private List<String> requiredActions;

    private List<DecisionGate> evaluatedGates;
}
