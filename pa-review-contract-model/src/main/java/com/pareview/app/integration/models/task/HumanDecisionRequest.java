package com.pareview.app.integration.models.task;

import com.pareview.app.integration.enumerations.DecisionOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a reviewer submits to close the human-decision task.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HumanDecisionRequest {

    @NotNull
    private DecisionOutcome finalOutcome;

    @NotBlank
    private String reviewerId;

    @NotBlank
    private String reviewerRole;

    private String justification;

    private String clinicalBasis;

    private String notes;
}
