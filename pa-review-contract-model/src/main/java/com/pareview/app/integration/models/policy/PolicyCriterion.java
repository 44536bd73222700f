package com.pareview.app.integration.models.policy;

import com.pareview.app.integration.enumerations.CriterionGrouping;
import com.pareview.app.integration.enumerations.RequirementLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One clause of a coverage policy.
 *
 * <p>Criteria sharing a {@code groupId} are combined using {@code grouping}; the first member's
 * grouping wins when members disagree. A criterion without a group stands alone.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PolicyCriterion {

    private String criterionId;

    private String text;

    private RequirementLevel requirementLevel;

    private String groupId;

    private CriterionGrouping grouping;

    private List<String> scopeTerms;
}
