package com.pareview.app.core.engine.checkpoint;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tools.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Durable output of a completed task, addressed by {@code (runId, taskId, version)}.
 *
 * <p>Checkpoints are immutable once written. Re-running a task writes the next version.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    private String runId;

    private String taskId;

    private int version;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant writtenAt;

    private JsonNode payload;
}
