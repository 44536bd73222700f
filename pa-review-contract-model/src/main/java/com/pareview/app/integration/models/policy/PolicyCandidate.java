package com.pareview.app.integration.models.policy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A coverage policy returned by policy search, ranked by relevance (0-100).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PolicyCandidate {

    private String policyId;

    private String title;

    private double relevanceScore;

    private List<PolicyCriterion> criteria;
}
