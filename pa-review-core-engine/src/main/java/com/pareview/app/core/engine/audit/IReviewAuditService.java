package com.pareview.app.core.engine.audit;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only audit trail of review runs.
 *
 * <h2>Recorded events</h2>
 * <ul>
 *   <li>Run creation, resumption and completion</li>
 *   <li>Each task start, completion, failure and reconciliation</li>
 *   <li>Halts, including waiting for a reviewer</li>
 *   <li>Reviewer confirmations, overrides and rejected overrides</li>
 * </ul>
 *
 * <p>Entries are never updated or deleted.</p>
 */
public interface IReviewAuditService {

    default Mono<Void> initialize() {
        return Mono.empty();
    }

    default Mono<Void> shutdown() {
        return Mono.empty();
    }

    Mono<ReviewAuditEntry> record(ReviewAuditEntry entry);

    /**
     * @return the run's entries in the order they were recorded
     */
    Flux<ReviewAuditEntry> getTrail(String runId);

    Flux<ReviewAuditEntry> getTrailForTask(String runId, String taskId);

    Flux<ReviewAuditEntry> findByAction(ReviewAuditAction action);
}
