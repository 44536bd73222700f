package com.pareview.app.core.engine.lock;

import com.pareview.app.core.exception.RunLockedException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keeps each run driven by a single owner at a time.
 *
 * <p>The ledger compare-and-set already rejects conflicting writes; the lock keeps a second
 * driver from starting work it would have to throw away.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * lockService.executeWithLock(runId, ownerId, Duration.ofMinutes(5), "run",
 *         () -> sequencer.complete(runId, taskId, payload));
 * }</pre>
 */
public interface IReviewRunLockService {

    /**
     * Acquires the lock if it is free, expired, or already held by the same owner.
     */
    Mono<Boolean> tryAcquire(String runId, String ownerId, Duration duration, String operation);

    /**
     * Releases the lock if held by the owner.
     */
    Mono<Boolean> release(String runId, String ownerId);

    Mono<Boolean> isLocked(String runId);

    Mono<Optional<RunLock>> getLockInfo(String runId);

    /**
     * Releases the lock regardless of owner. For operators recovering a stuck run.
     */
    Mono<Boolean> forceRelease(String runId, String reason);

    /**
     * Runs the action while holding the lock and releases it afterwards, whatever the outcome.
     *
     * @return the action's result, or {@link RunLockedException} if the lock is held elsewhere
     */
    default <T> Mono<T> executeWithLock(String runId, String ownerId, Duration duration, String operation,
                                        Supplier<Mono<T>> action) {
        return tryAcquire(runId, ownerId, duration, operation)
                .flatMap(acquired -> {
                    if (!acquired) {
                        return getLockInfo(runId)
                                .defaultIfEmpty(Optional.empty())
                                .flatMap(info -> Mono.<T>error(
                                        new RunLockedException(runId, info.map(RunLock::getOwnerId).orElse(null))));
                    }
                    // released before the result is signalled, so the caller can re-acquire at once
                    return Mono.defer(action)
                            .flatMap(result -> release(runId, ownerId).thenReturn(result))
                            .switchIfEmpty(Mono.defer(() -> release(runId, ownerId).then(Mono.<T>empty())))
                            .onErrorResume(error -> release(runId, ownerId).then(Mono.<T>error(error)))
                            .doOnCancel(() -> release(runId, ownerId).subscribe());
                });
    }
}
