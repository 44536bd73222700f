package com.pareview.app.core.engine.audit.impl;

import com.pareview.app.core.engine.audit.IReviewAuditService;
import com.pareview.app.core.engine.audit.ReviewAuditAction;
import com.pareview.app.core.engine.audit.ReviewAuditEntry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory audit trail, indexed by run.
 */
@Slf4j
public class InMemoryReviewAuditService implements IReviewAuditService {

    private final Map<String, List<ReviewAuditEntry>> entriesByRun = new ConcurrentHashMap<>();
    private final Map<ReviewAuditAction, AtomicLong> actionCounts = new EnumMap<>(ReviewAuditAction.class);

    public InMemoryReviewAuditService() {
        for (ReviewAuditAction action : ReviewAuditAction.values()) {
            actionCounts.put(action, new AtomicLong());
        }
    }

    @Override
    public Mono<ReviewAuditEntry> record(ReviewAuditEntry entry) {
        return Mono.fromCallable(() -> {
            Objects.requireNonNull(entry.getRunId(), "audit entry must carry a runId");
            entriesByRun.computeIfAbsent(entry.getRunId(), key -> new CopyOnWriteArrayList<>()).add(entry);
            actionCounts.get(entry.getAction()).incrementAndGet();
            log.info("Audit: runId={}, taskId={}, action={}, actor={}, description={}",
                    entry.getRunId(), entry.getTaskId(), entry.getAction(), entry.getActorId(), entry.getDescription());
            return entry;
        });
    }

    @Override
    public Flux<ReviewAuditEntry> getTrail(String runId) {
        return Flux.defer(() -> Flux.fromIterable(entriesByRun.getOrDefault(runId, List.of())));
    }

    @Override
    public Flux<ReviewAuditEntry> getTrailForTask(String runId, String taskId) {
        return getTrail(runId).filter(entry -> taskId.equals(entry.getTaskId()));
    }

    @Override
    public Flux<ReviewAuditEntry> findByAction(ReviewAuditAction action) {
        return Flux.defer(() -> Flux.fromIterable(entriesByRun.values())
                .flatMapIterable(entries -> entries)
                .filter(entry -> entry.getAction() == action));
    }

    public long countByAction(ReviewAuditAction action) {
        return actionCounts.get(action).get();
    }
}
