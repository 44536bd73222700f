package com.pareview.app.core.engine.ledger.impl;

import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.exception.ConcurrentLedgerUpdateException;
import com.pareview.app.integration.enumerations.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileBasedTaskLedgerStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-05T08:00:00Z");

    @TempDir
    Path baseDir;

    private FileBasedTaskLedgerStore open() {
        FileBasedTaskLedgerStore store = new FileBasedTaskLedgerStore(baseDir);
        store.initialize().block();
        return store;
    }

    @Test
    @DisplayName("ledgers survive a restart of the store")
    void persistsAcrossRestart() {
        FileBasedTaskLedgerStore store = open();
        TaskLedger created = store.create(TaskLedger.create("r1", "CASE-1", List.of("intake", "compliance"), NOW)).block();
        store.compareAndSave(created.withTask(created.requireTask("intake").start("r1", NOW), NOW), 0).block();
        store.shutdown().block();

        FileBasedTaskLedgerStore reopened = open();
        TaskLedger loaded = reopened.findByRunId("r1").block();

        assertEquals(1, loaded.getRevision());
        assertEquals(TaskStatus.IN_PROGRESS, loaded.requireTask("intake").getStatus());
        assertEquals(NOW, loaded.requireTask("intake").getStartedAt());
        assertTrue(Files.exists(baseDir.resolve("ledgers").resolve("r1.json")));
        assertFalse(Files.exists(baseDir.resolve("ledgers").resolve("r1.json.tmp")));
    }

    @Test
    @DisplayName("the revision check also holds after a restart")
    void staleRevisionAfterRestart() {
        FileBasedTaskLedgerStore store = open();
        TaskLedger created = store.create(TaskLedger.create("r1", "CASE-1", List.of("intake"), NOW)).block();
        store.compareAndSave(created, 0).block();

        FileBasedTaskLedgerStore reopened = open();

        assertThrows(ConcurrentLedgerUpdateException.class, () -> reopened.compareAndSave(created, 0).block());
    }

    @Test
    @DisplayName("using the store before initialize fails")
    void notInitialized() {
        FileBasedTaskLedgerStore store = new FileBasedTaskLedgerStore(baseDir);

        assertThrows(IllegalStateException.class, () -> store.findByRunId("r1").block());
    }
}
