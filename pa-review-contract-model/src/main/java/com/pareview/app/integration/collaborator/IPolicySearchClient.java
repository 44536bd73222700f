package com.pareview.app.integration.collaborator;

import com.pareview.app.integration.models.policy.PolicyCandidate;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Searches coverage policies.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Results are ranked, most relevant first</li>
 *   <li>Each candidate carries its criteria in policy order</li>
 *   <li>No match yields an empty list, not an error</li>
 * </ul>
 */
public interface IPolicySearchClient {

    Mono<List<PolicyCandidate>> search(List<String> queryTerms);
}
