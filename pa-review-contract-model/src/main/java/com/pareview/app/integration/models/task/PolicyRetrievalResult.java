package com.pareview.app.integration.models.task;

import com.pareview.app.integration.models.policy.PolicyCandidate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PolicyRetrievalResult {

    private List<String> queryTerms;

    private boolean searchCompleted;

    private List<PolicyCandidate> candidates;

    /** Highest-ranked candidate above the relevance floor, or null when none qualifies. */
    private PolicyCandidate selectedPolicy;
}
