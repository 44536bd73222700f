package com.pareview.app.core.engine.checkpoint;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Append-only storage of task checkpoints.
 *
 * <p>A write never touches an existing version: the first write for a {@code (runId, taskId)}
 * pair creates version 1, each later write creates the next version. Readers normally want the
 * latest version.</p>
 */
public interface ICheckpointStore {

    Mono<Void> initialize();

    Mono<Void> shutdown();

    /**
     * Appends a new version of the checkpoint for the task.
     *
     * @return the stored checkpoint, with its assigned version and write time
     */
    Mono<Checkpoint> write(String runId, String taskId, JsonNode payload);

    /**
     * @return the highest version, or empty if the task has no checkpoint
     */
    Mono<Checkpoint> findLatest(String runId, String taskId);

    Mono<Checkpoint> findVersion(String runId, String taskId, int version);

    /**
     * @return every version, oldest first
     */
    Flux<Checkpoint> listVersions(String runId, String taskId);
}
