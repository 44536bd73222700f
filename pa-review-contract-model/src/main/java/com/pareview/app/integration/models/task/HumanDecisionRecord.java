package com.pareview.app.integration.models.task;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import com.pareview.app.integration.models.decision.DecisionOverride;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The reviewer's final word on a case.
 *
 * <p>When the reviewer confirms the candidate, {@code override} is null. Otherwise it holds the
 * override and {@code finalOutcome} is authoritative; the candidate is kept for audit.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HumanDecisionRecord {

    private DecisionOutcome candidateOutcome;

    private DecisionOutcome finalOutcome;

    private DecisionOverride override;

    private String decidedBy;

    private String reviewerRole;

    private String notes;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant decidedAt;
}
