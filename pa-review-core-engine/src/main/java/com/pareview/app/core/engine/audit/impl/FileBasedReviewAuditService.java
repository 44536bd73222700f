package com.pareview.app.core.engine.audit.impl;

import com.pareview.app.core.engine.audit.IReviewAuditService;
import com.pareview.app.core.engine.audit.ReviewAuditAction;
import com.pareview.app.core.engine.audit.ReviewAuditEntry;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * File-based audit trail. Each run's trail is one JSON array, appended to and rewritten as a whole.
 *
 * <h2>Storage Structure</h2>
 * <pre>
 * {baseDir}/
 *   └── audit/
 *       ├── {runId}.json
 *       └── ...
 * </pre>
 *
 * <p>Documents are replaced through a temporary sibling and an atomic move. Reads are served from
 * the trails loaded at {@link #initialize()}.</p>
 */
@Slf4j
public class FileBasedReviewAuditService implements IReviewAuditService {

    private static final String AUDIT_DIR = "audit";
    private static final String TRAIL_EXTENSION = ".json";

    private final Path auditDir;
    private final ReviewObjectMapper mapper = ReviewObjectMapper.getInstance();

    private final Map<String, List<ReviewAuditEntry>> trails = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    public FileBasedReviewAuditService(Path baseDir) {
        this.auditDir = baseDir.resolve(AUDIT_DIR);
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
            log.info("Initializing file-based audit trail at: {}", auditDir);
            Files.createDirectories(auditDir);
            loadExistingTrails();
            initialized = true;
            log.info("File-based audit trail initialized. Loaded {} trails.", trails.size());
            return null;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    private void loadExistingTrails() throws IOException {
        try (Stream<Path> files = Files.list(auditDir)) {
            files.filter(path -> path.getFileName().toString().endsWith(TRAIL_EXTENSION))
                    .forEach(this::loadTrailFile);
        }
    }

    private void loadTrailFile(Path file) {
        try {
            String fileName = file.getFileName().toString();
            String runId = fileName.substring(0, fileName.length() - TRAIL_EXTENSION.length());
            ReviewAuditEntry[] entries = mapper.readValue(Files.readAllBytes(file), ReviewAuditEntry[].class);
            trails.put(runId, List.copyOf(Arrays.asList(entries)));
            log.debug("Loaded audit trail: runId={}, entries={}", runId, entries.length);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load audit file " + file, e);
        }
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down file-based audit trail");
            trails.clear();
            initialized = false;
        });
    }

    @Override
    public Mono<ReviewAuditEntry> record(ReviewAuditEntry entry) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            String runId = Objects.requireNonNull(entry.getRunId(), "audit entry must carry a runId");
            trails.compute(runId, (key, existing) -> {
                List<ReviewAuditEntry> appended = new ArrayList<>(existing == null ? List.of() : existing);
                appended.add(entry);
                writeTrail(runId, appended);
                return List.copyOf(appended);
            });
            log.info("Audit: runId={}, taskId={}, action={}, actor={}, description={}",
                    runId, entry.getTaskId(), entry.getAction(), entry.getActorId(), entry.getDescription());
            return entry;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<ReviewAuditEntry> getTrail(String runId) {
        return Flux.defer(() -> {
            ensureInitialized();
            return Flux.fromIterable(trails.getOrDefault(runId, List.of()));
        });
    }

    @Override
    public Flux<ReviewAuditEntry> getTrailForTask(String runId, String taskId) {
        return getTrail(runId).filter(entry -> taskId.equals(entry.getTaskId()));
    }

    @Override
    public Flux<ReviewAuditEntry> findByAction(ReviewAuditAction action) {
        return Flux.defer(() -> {
            ensureInitialized();
            return Flux.fromIterable(trails.values())
                    .flatMapIterable(entries -> entries)
                    .filter(entry -> entry.getAction() == action);
        });
    }

    private void writeTrail(String runId, List<ReviewAuditEntry> entries) {
        Path target = auditDir.resolve(runId + TRAIL_EXTENSION);
        Path temp = auditDir.resolve(runId + TRAIL_EXTENSION + ".tmp");
        try {
            Files.write(temp, mapper.writeValueAsBytes(entries));
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit trail for run " + runId, e);
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("File-based audit trail not initialized");
        }
    }
}
