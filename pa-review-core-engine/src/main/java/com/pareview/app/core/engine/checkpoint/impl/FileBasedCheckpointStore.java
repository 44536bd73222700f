package com.pareview.app.core.engine.checkpoint.impl;

import com.pareview.app.core.engine.checkpoint.Checkpoint;
import com.pareview.app.core.engine.checkpoint.ICheckpointStore;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * File-based checkpoint store. One JSON document per checkpoint version.
 *
 * <h2>Storage Structure</h2>
 * <pre>
 * {baseDir}/
 *   └── checkpoints/
 *       └── {runId}/
 *           └── {taskId}/
 *               ├── v1.json
 *               └── v2.json
 * </pre>
 *
 * <p>A version file is written once, through a temporary file and an atomic move, and never
 * rewritten.</p>
 */
@Slf4j
public class FileBasedCheckpointStore implements ICheckpointStore {

    private static final String CHECKPOINTS_DIR = "checkpoints";
    private static final String VERSION_PREFIX = "v";
    private static final String DOCUMENT_EXTENSION = ".json";

    private final Path checkpointsDir;
    private final Clock clock;
    private final ReviewObjectMapper mapper = ReviewObjectMapper.getInstance();

    // Highest version per run/task key, guards version assignment
    private final Map<String, Integer> latestVersions = new ConcurrentHashMap<>();

    public FileBasedCheckpointStore(Path baseDir) {
        this(baseDir, Clock.systemUTC());
    }

    public FileBasedCheckpointStore(Path baseDir, Clock clock) {
        this.checkpointsDir = baseDir.resolve(CHECKPOINTS_DIR);
        this.clock = clock;
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
            log.info("Initializing file-based checkpoint store at: {}", checkpointsDir);
            Files.createDirectories(checkpointsDir);
            return null;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down file-based checkpoint store");
            latestVersions.clear();
        });
    }

    @Override
    public Mono<Checkpoint> write(String runId, String taskId, JsonNode payload) {
        return Mono.fromCallable(() -> {
            Checkpoint[] written = new Checkpoint[1];
            latestVersions.compute(key(runId, taskId), (key, latest) -> {
                int current = latest != null ? latest : scanLatestVersion(runId, taskId);
                Checkpoint checkpoint = Checkpoint.builder()
                        .runId(runId)
                        .taskId(taskId)
                        .version(current + 1)
                        .writtenAt(clock.instant())
                        .payload(payload)
                        .build();
                writeDocument(checkpoint);
                written[0] = checkpoint;
                return checkpoint.getVersion();
            });
            log.debug("Wrote checkpoint file: runId={}, taskId={}, version={}", runId, taskId, written[0].getVersion());
            return readDocument(versionFile(runId, taskId, written[0].getVersion()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Checkpoint> findLatest(String runId, String taskId) {
        return Mono.fromCallable(() -> {
            int latest = scanLatestVersion(runId, taskId);
            return latest == 0 ? null : readDocument(versionFile(runId, taskId, latest));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Checkpoint> findVersion(String runId, String taskId, int version) {
        return Mono.fromCallable(() -> {
            Path file = versionFile(runId, taskId, version);
            return Files.exists(file) ? readDocument(file) : null;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<Checkpoint> listVersions(String runId, String taskId) {
        return Flux.defer(() -> Flux.fromIterable(versionNumbers(runId, taskId)))
                .map(version -> readDocument(versionFile(runId, taskId, version)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private int scanLatestVersion(String runId, String taskId) {
        List<Integer> numbers = versionNumbers(runId, taskId);
        return numbers.isEmpty() ? 0 : numbers.get(numbers.size() - 1);
    }

    private List<Integer> versionNumbers(String runId, String taskId) {
        Path taskDir = taskDir(runId, taskId);
        if (!Files.isDirectory(taskDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(taskDir)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.startsWith(VERSION_PREFIX) && name.endsWith(DOCUMENT_EXTENSION))
                    .map(name -> name.substring(VERSION_PREFIX.length(), name.length() - DOCUMENT_EXTENSION.length()))
                    .filter(number -> !number.isEmpty() && number.chars().allMatch(Character::isDigit))
                    .map(Integer::parseInt)
                    .sorted(Comparator.naturalOrder())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list checkpoints in " + taskDir, e);
        }
    }

    private void writeDocument(Checkpoint checkpoint) {
        Path target = versionFile(checkpoint.getRunId(), checkpoint.getTaskId(), checkpoint.getVersion());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        if (Files.exists(target)) {
            throw new IllegalStateException("Checkpoint version already exists: " + target);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(temp, mapper.writeValueAsBytes(checkpoint));
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write checkpoint " + target, e);
        }
    }

    private Checkpoint readDocument(Path file) {
        try {
            return mapper.readValue(Files.readAllBytes(file), Checkpoint.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + file, e);
        }
    }

    private Path taskDir(String runId, String taskId) {
        return checkpointsDir.resolve(runId).resolve(taskId);
    }

    private Path versionFile(String runId, String taskId, int version) {
        return taskDir(runId, taskId).resolve(VERSION_PREFIX + version + DOCUMENT_EXTENSION);
    }

    private static String key(String runId, String taskId) {
        return runId + "/" + taskId;
    }
}
