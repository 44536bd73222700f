package com.pareview.app.core.engine.lock.impl;

import com.pareview.app.core.engine.lock.RunLock;
import com.pareview.app.core.exception.RunLockedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRunLockServiceTest {

    private static final Duration MINUTE = Duration.ofMinutes(1);

    private InMemoryRunLockService lockService;

    @BeforeEach
    void setUp() {
        lockService = new InMemoryRunLockService(MINUTE);
    }

    @Test
    @DisplayName("only one owner holds a run at a time")
    void exclusiveOwnership() {
        assertTrue(lockService.tryAcquire("r1", "driver-a", MINUTE, "run").block());
        assertFalse(lockService.tryAcquire("r1", "driver-b", MINUTE, "run").block());
        assertTrue(lockService.tryAcquire("r2", "driver-b", MINUTE, "run").block());

        assertEquals(2, lockService.getStatistics().activeLocks());
        assertEquals(1, lockService.getStatistics().rejected());
    }

    @Test
    @DisplayName("re-acquiring by the same owner extends the lock")
    void reentrantExtension() {
        lockService.tryAcquire("r1", "driver-a", MINUTE, "run").block();
        assertTrue(lockService.tryAcquire("r1", "driver-a", MINUTE, "human-decision").block());

        RunLock lock = lockService.getLockInfo("r1").block().orElseThrow();
        assertEquals(1, lock.getExtensionCount());
        assertEquals("run", lock.getOperation());
    }

    @Test
    @DisplayName("an expired lock is taken over")
    void expiredTakeover() throws InterruptedException {
        lockService.tryAcquire("r1", "driver-a", Duration.ofMillis(1), "run").block();
        Thread.sleep(20);

        assertFalse(lockService.isLocked("r1").block());
        assertTrue(lockService.tryAcquire("r1", "driver-b", MINUTE, "run").block());
        assertEquals(1, lockService.getStatistics().expiredTakeovers());
    }

    @Test
    @DisplayName("only the owner can release, force release ignores ownership")
    void release() {
        lockService.tryAcquire("r1", "driver-a", MINUTE, "run").block();

        assertFalse(lockService.release("r1", "driver-b").block());
        assertTrue(lockService.isLocked("r1").block());
        assertTrue(lockService.release("r1", "driver-a").block());
        assertFalse(lockService.isLocked("r1").block());

        lockService.tryAcquire("r1", "driver-a", MINUTE, "run").block();
        assertTrue(lockService.forceRelease("r1", "stuck driver").block());
        assertEquals(Optional.empty(), lockService.getLockInfo("r1").block());
    }

    @Test
    @DisplayName("executeWithLock releases after the action and reports the holder on conflict")
    void executeWithLock() {
        String result = lockService.executeWithLock("r1", "driver-a", MINUTE, "run", () -> Mono.just("done")).block();
        assertEquals("done", result);
        assertFalse(lockService.isLocked("r1").block());

        lockService.tryAcquire("r1", "driver-a", MINUTE, "run").block();
        StepVerifier.create(lockService.executeWithLock("r1", "driver-b", MINUTE, "run", () -> Mono.just("never")))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(RunLockedException.class, error);
                    assertEquals("driver-a", ((RunLockedException) error).getCurrentHolder());
                })
                .verify();
    }

    @Test
    @DisplayName("the lock is free by the time the caller sees the result")
    void releasedBeforeResultIsSignalled() {
        Boolean reacquired = lockService.executeWithLock("r1", "driver-a", MINUTE, "run", () -> Mono.just("done"))
                .flatMap(result -> lockService.tryAcquire("r1", "driver-b", MINUTE, "run"))
                .block();

        assertTrue(reacquired);
    }

    @Test
    @DisplayName("the lock is released when the action fails or completes empty")
    void releasedOnErrorAndEmpty() {
        StepVerifier.create(lockService.executeWithLock("r1", "driver-a", MINUTE, "run",
                        () -> Mono.<String>error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();
        assertFalse(lockService.isLocked("r1").block());

        StepVerifier.create(lockService.executeWithLock("r1", "driver-a", MINUTE, "run", Mono::<String>empty))
                .verifyComplete();
        assertFalse(lockService.isLocked("r1").block());
    }

    @Test
    @DisplayName("a conflict still fails when the holder has vanished")
    void conflictWithoutLockInfo() {
        InMemoryRunLockService noInfo = new InMemoryRunLockService(MINUTE) {
            @Override
            public Mono<Optional<RunLock>> getLockInfo(String runId) {
                return Mono.empty();
            }
        };
        noInfo.tryAcquire("r1", "driver-a", MINUTE, "run").block();

        StepVerifier.create(noInfo.executeWithLock("r1", "driver-b", MINUTE, "run", () -> Mono.just("never")))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(RunLockedException.class, error);
                    assertNull(((RunLockedException) error).getCurrentHolder());
                })
                .verify();
    }

    @Test
    void nullOwnerIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> lockService.tryAcquireSync("r1", null, MINUTE, "run"));
    }
}
