package com.pareview.app.core.engine.ledger.impl;

import com.pareview.app.core.engine.ledger.ITaskLedgerStore;
import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import com.pareview.app.core.exception.ConcurrentLedgerUpdateException;
import com.pareview.app.core.exception.LedgerInvariantViolationException;
import com.pareview.app.core.exception.RunNotFoundException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.enumerations.RunStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * File-based ledger store. Each run's ledger is one JSON document.
 *
 * <h2>Storage Structure</h2>
 * <pre>
 * {baseDir}/
 *   └── ledgers/
 *       ├── {runId}.json
 *       └── ...
 * </pre>
 *
 * <p>Documents are written to a temporary sibling and moved into place atomically, so a crash
 * never leaves a half-written ledger. Reads are served from an in-memory cache populated at
 * {@link #initialize()}.</p>
 */
@Slf4j
public class FileBasedTaskLedgerStore implements ITaskLedgerStore {

    private static final String LEDGERS_DIR = "ledgers";
    private static final String LEDGER_EXTENSION = ".json";

    private final Path ledgersDir;
    private final ReviewObjectMapper mapper = ReviewObjectMapper.getInstance();

    // Cache of serialized documents, mirrors the files on disk
    private final Map<String, byte[]> cache = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    public FileBasedTaskLedgerStore(Path baseDir) {
        this.ledgersDir = baseDir.resolve(LEDGERS_DIR);
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
            log.info("Initializing file-based task ledger store at: {}", ledgersDir);
            Files.createDirectories(ledgersDir);
            loadExistingLedgers();
            initialized = true;
            log.info("File-based task ledger store initialized. Loaded {} ledgers.", cache.size());
            return null;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    private void loadExistingLedgers() throws IOException {
        try (Stream<Path> files = Files.list(ledgersDir)) {
            files.filter(path -> path.getFileName().toString().endsWith(LEDGER_EXTENSION))
                    .forEach(this::loadLedgerFile);
        }
    }

    private void loadLedgerFile(Path file) {
        try {
            byte[] document = Files.readAllBytes(file);
            TaskLedger ledger = decode(document);
            cache.put(ledger.getRunId(), document);
            log.debug("Loaded ledger: {}", ledger.getRunId());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load ledger file " + file, e);
        }
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down file-based task ledger store");
            cache.clear();
            initialized = false;
        });
    }

    // ========================================================================
    // OPERATIONS
    // ========================================================================

    @Override
    public Mono<TaskLedger> create(TaskLedger ledger) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            ledger.validateInvariants();
            TaskLedger initial = ledger.toBuilder().revision(0).build();
            String runId = initial.getRunId();
            byte[][] saved = new byte[1][];
            cache.compute(runId, (key, existing) -> {
                if (existing != null) {
                    throw new LedgerInvariantViolationException(PaReviewInternalErrorCodes.LEDGER_ALREADY_EXISTS,
                            Map.of("runId", runId));
                }
                saved[0] = mapper.writeValueAsBytes(initial);
                writeDocument(runId, saved[0]);
                return saved[0];
            });
            log.debug("Created ledger file: runId={}", runId);
            return decode(saved[0]);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<TaskLedger> findByRunId(String runId) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            byte[] document = cache.get(runId);
            return document == null ? null : decode(document);
        });
    }

    @Override
    public Mono<TaskLedger> compareAndSave(TaskLedger updated, long expectedRevision) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            updated.validateInvariants();
            String runId = updated.getRunId();
            byte[][] saved = new byte[1][];
            cache.compute(runId, (key, existing) -> {
                if (existing == null) {
                    throw new RunNotFoundException(runId);
                }
                long actualRevision = decode(existing).getRevision();
                if (actualRevision != expectedRevision) {
                    throw new ConcurrentLedgerUpdateException(runId, expectedRevision, actualRevision);
                }
                saved[0] = mapper.writeValueAsBytes(updated.toBuilder().revision(expectedRevision + 1).build());
                writeDocument(runId, saved[0]);
                return saved[0];
            });
            log.debug("Saved ledger file: runId={}, revision={}", runId, expectedRevision + 1);
            return decode(saved[0]);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<TaskLedger> findAll() {
        return Flux.defer(() -> {
            ensureInitialized();
            return Flux.fromIterable(cache.values()).map(this::decode);
        });
    }

    @Override
    public Flux<TaskLedger> findByStatus(RunStatus status) {
        return findAll().filter(ledger -> ledger.getStatus() == status);
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private void writeDocument(String runId, byte[] document) {
        Path target = ledgersDir.resolve(runId + LEDGER_EXTENSION);
        Path temp = ledgersDir.resolve(runId + LEDGER_EXTENSION + ".tmp");
        try {
            Files.write(temp, document);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ledger for run " + runId, e);
        }
    }

    private TaskLedger decode(byte[] document) {
        return mapper.readValue(document, TaskLedger.class);
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("File-based task ledger store not initialized");
        }
    }
}
