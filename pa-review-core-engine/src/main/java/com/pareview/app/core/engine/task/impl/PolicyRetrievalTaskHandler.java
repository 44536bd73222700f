package com.pareview.app.core.engine.task.impl;

import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.integration.collaborator.IPolicySearchClient;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.models.policy.PolicyCandidate;
import com.pareview.app.integration.models.task.IntakeSummary;
import com.pareview.app.integration.models.task.PolicyRetrievalResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds the coverage policy that applies to the requested service.
 *
 * <p>An unavailable search degrades to "no policy located", which the policy gate pends on.</p>
 */
@Slf4j
public class PolicyRetrievalTaskHandler implements IReviewTaskHandler {

    private final IPolicySearchClient policyClient;
    private final double minimumRelevance;
    private final Duration collaboratorTimeout;

    public PolicyRetrievalTaskHandler(IPolicySearchClient policyClient, double minimumRelevance, Duration collaboratorTimeout) {
        this.policyClient = Objects.requireNonNull(policyClient, "policyClient");
        this.minimumRelevance = minimumRelevance;
        this.collaboratorTimeout = collaboratorTimeout != null ? collaboratorTimeout : Duration.ofSeconds(10);
    }

    @Override
    public String taskId() {
        return ReviewTaskIds.POLICY_RETRIEVAL;
    }

    @Override
    public Mono<Object> execute(IReviewTaskContext context) {
        return context.readCheckpoint(ReviewTaskIds.INTAKE, IntakeSummary.class).flatMap(intake -> {
            List<String> query = queryTerms(intake);
            return policyClient.search(query)
                    .timeout(collaboratorTimeout)
                    .defaultIfEmpty(List.of())
                    .map(candidates -> select(query, candidates))
                    .onErrorResume(error -> {
                        log.warn("Policy search unavailable, continuing without a policy: caseId={}, error={}",
                                intake.getCaseId(), error.toString());
                        return Mono.just(PolicyRetrievalResult.builder()
                                .queryTerms(query)
                                .searchCompleted(false)
                                .candidates(List.of())
                                .build());
                    });
        });
    }

    static List<String> queryTerms(IntakeSummary intake) {
        List<String> terms = new ArrayList<>();
        terms.add(intake.getServiceDescription());
        if (intake.getCptCodes() != null) {
            terms.addAll(intake.getCptCodes());
        }
        if (intake.getIcd10Codes() != null) {
            terms.addAll(intake.getIcd10Codes());
        }
        return List.copyOf(terms);
    }

    private PolicyRetrievalResult select(List<String> query, List<PolicyCandidate> candidates) {
        List<PolicyCandidate> ranked = candidates.stream()
                .sorted(Comparator.comparingDouble(PolicyCandidate::getRelevanceScore).reversed())
                .toList();
        PolicyCandidate selected = ranked.stream()
                .filter(candidate -> candidate.getRelevanceScore() >= minimumRelevance)
                .findFirst()
                .orElse(null);
        log.info("Policy search returned {} candidate(s), selected={}",
                ranked.size(), selected != null ? selected.getPolicyId() : "none");
        return PolicyRetrievalResult.builder()
                .queryTerms(query)
                .searchCompleted(true)
                .candidates(ranked)
                .selectedPolicy(selected)
                .build();
    }
}
