package com.pareview.app.core.engine.checkpoint.impl;

import com.pareview.app.core.engine.checkpoint.Checkpoint;
import com.pareview.app.core.engine.checkpoint.ICheckpointStore;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory checkpoint store. Every version is kept as the serialized document it was written as.
 */
@Slf4j
public class InMemoryCheckpointStore implements ICheckpointStore {

    private final Map<String, List<byte[]>> versions = new ConcurrentHashMap<>();
    private final ReviewObjectMapper mapper = ReviewObjectMapper.getInstance();
    private final Clock clock;

    public InMemoryCheckpointStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCheckpointStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromRunnable(() -> log.info("In-memory checkpoint store initialized"));
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(versions::clear);
    }

    @Override
    public Mono<Checkpoint> write(String runId, String taskId, JsonNode payload) {
        return Mono.fromCallable(() -> {
            Checkpoint[] written = new Checkpoint[1];
            versions.compute(key(runId, taskId), (key, existing) -> {
                List<byte[]> history = existing == null ? new CopyOnWriteArrayList<>() : existing;
                Checkpoint checkpoint = Checkpoint.builder()
                        .runId(runId)
                        .taskId(taskId)
                        .version(history.size() + 1)
                        .writtenAt(clock.instant())
                        .payload(payload)
                        .build();
                history.add(mapper.writeValueAsBytes(checkpoint));
                written[0] = checkpoint;
                return history;
            });
            log.debug("Wrote checkpoint: runId={}, taskId={}, version={}", runId, taskId, written[0].getVersion());
            return decode(mapper.writeValueAsBytes(written[0]));
        });
    }

    @Override
    public Mono<Checkpoint> findLatest(String runId, String taskId) {
        return Mono.fromCallable(() -> {
            List<byte[]> history = versions.get(key(runId, taskId));
            if (history == null || history.isEmpty()) {
                return null;
            }
            return decode(history.get(history.size() - 1));
        });
    }

    @Override
    public Mono<Checkpoint> findVersion(String runId, String taskId, int version) {
        return Mono.fromCallable(() -> {
            List<byte[]> history = versions.get(key(runId, taskId));
            if (history == null || version < 1 || version > history.size()) {
                return null;
            }
            return decode(history.get(version - 1));
        });
    }

    @Override
    public Flux<Checkpoint> listVersions(String runId, String taskId) {
        return Flux.defer(() -> Flux.fromIterable(versions.getOrDefault(key(runId, taskId), List.of()))
                .map(this::decode));
    }

    private Checkpoint decode(byte[] document) {
        return mapper.readValue(document, Checkpoint.class);
    }

    private static String key(String runId, String taskId) {
        return runId + "/" + taskId;
    }
}
