package com.pareview.app.integration.models.decision;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A reviewer's correction of a candidate decision. Immutable once recorded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DecisionOverride {

    private DecisionOutcome priorOutcome;

    private DecisionOutcome finalOutcome;

    private String justification;

    private String clinicalBasis;

    private String reviewerId;

    private String reviewerRole;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;
}
