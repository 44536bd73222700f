package com.pareview.app.core.engine.lock;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * Exclusive claim of one driver on one run.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class RunLock {

    private final String runId;

    private final String ownerId;

    /** What the owner is doing, for diagnostics. */
    private final String operation;

    private final Instant acquiredAt;

    private final Instant expiresAt;

    private final int extensionCount;

    public static RunLock create(String runId, String ownerId, Duration duration, String operation) {
        Instant now = Instant.now();
        return RunLock.builder()
                .runId(runId)
                .ownerId(ownerId)
                .operation(operation)
                .acquiredAt(now)
                .expiresAt(now.plus(duration))
                .build();
    }

    public boolean isExpired() {
        return expiresAt != null && Instant.now().isAfter(expiresAt);
    }

    public boolean isHeldBy(String candidateOwner) {
        return ownerId.equals(candidateOwner) && !isExpired();
    }

    public RunLock extend(Duration extension) {
        return toBuilder()
                .expiresAt(Instant.now().plus(extension))
                .extensionCount(extensionCount + 1)
                .build();
    }
}
