package com.pareview.app.core.engine.lock.impl;

import com.pareview.app.core.engine.lock.IReviewRunLockService;
import com.pareview.app.core.engine.lock.RunLock;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory run lock service for single-process deployments.
 *
 * <p>Expired locks are taken over on the next acquisition attempt rather than by a background sweep.</p>
 */
@Slf4j
public class InMemoryRunLockService implements IReviewRunLockService {

    private final Map<String, RunLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong acquiredCount = new AtomicLong(0);
    private final AtomicLong rejectedCount = new AtomicLong(0);
    private final AtomicLong expiredCount = new AtomicLong(0);

    private final Duration defaultLockDuration;

    public InMemoryRunLockService() {
        this(Duration.ofMinutes(5));
    }

    public InMemoryRunLockService(Duration defaultLockDuration) {
        this.defaultLockDuration = defaultLockDuration;
    }

    @Override
    public Mono<Boolean> tryAcquire(String runId, String ownerId, Duration duration, String operation) {
        return Mono.fromCallable(() -> tryAcquireSync(runId, ownerId, duration, operation));
    }

    public boolean tryAcquireSync(String runId, String ownerId, Duration duration, String operation) {
        if (runId == null || ownerId == null) {
            throw new IllegalArgumentException("runId and ownerId cannot be null");
        }
        Duration lockDuration = duration != null ? duration : defaultLockDuration;

        boolean acquired = locks.compute(runId, (key, existing) -> {
            if (existing == null) {
                log.debug("Acquiring run lock: runId={}, owner={}, operation={}", runId, ownerId, operation);
                acquiredCount.incrementAndGet();
                return RunLock.create(runId, ownerId, lockDuration, operation);
            }
            if (existing.getOwnerId().equals(ownerId)) {
                return existing.extend(lockDuration);
            }
            if (existing.isExpired()) {
                log.debug("Taking over expired run lock: runId={}, previousOwner={}, newOwner={}",
                        runId, existing.getOwnerId(), ownerId);
                expiredCount.incrementAndGet();
                acquiredCount.incrementAndGet();
                return RunLock.create(runId, ownerId, lockDuration, operation);
            }
            return existing;
        }).getOwnerId().equals(ownerId);

        if (!acquired) {
            rejectedCount.incrementAndGet();
            log.warn("Run lock held by another owner: runId={}, requester={}", runId, ownerId);
        }
        return acquired;
    }

    @Override
    public Mono<Boolean> release(String runId, String ownerId) {
        return Mono.fromCallable(() -> {
            boolean[] released = {false};
            locks.computeIfPresent(runId, (key, existing) -> {
                if (existing.getOwnerId().equals(ownerId)) {
                    released[0] = true;
                    return null;
                }
                log.warn("Cannot release run lock - not owner: runId={}, holder={}, requester={}",
                        runId, existing.getOwnerId(), ownerId);
                return existing;
            });
            return released[0];
        });
    }

    @Override
    public Mono<Boolean> isLocked(String runId) {
        return Mono.fromCallable(() -> {
            RunLock lock = locks.get(runId);
            return lock != null && !lock.isExpired();
        });
    }

    @Override
    public Mono<Optional<RunLock>> getLockInfo(String runId) {
        return Mono.fromCallable(() -> Optional.ofNullable(locks.get(runId)).filter(lock -> !lock.isExpired()));
    }

    @Override
    public Mono<Boolean> forceRelease(String runId, String reason) {
        return Mono.fromCallable(() -> {
            RunLock removed = locks.remove(runId);
            if (removed != null) {
                log.warn("Force released run lock: runId={}, owner={}, reason={}", runId, removed.getOwnerId(), reason);
                return true;
            }
            return false;
        });
    }

    public LockStatistics getStatistics() {
        return new LockStatistics(
                locks.values().stream().filter(lock -> !lock.isExpired()).count(),
                acquiredCount.get(),
                rejectedCount.get(),
                expiredCount.get());
    }

    public record LockStatistics(long activeLocks, long acquired, long rejected, long expiredTakeovers) {
    }
}
