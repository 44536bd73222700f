package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.checkpoint.ICheckpointStore;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.exception.CaseInputException;
import com.pareview.app.core.exception.LedgerInvariantViolationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.models.request.PriorAuthRequest;
import lombok.AllArgsConstructor;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Task context that only exposes checkpoints of earlier tasks.
 */
@Getter
@AllArgsConstructor
public class ReviewTaskContext implements IReviewTaskContext {

    private final String runId;
    private final String caseId;
    private final String taskId;
    private final boolean submissionReader;
    private final ReviewPipelineDefinition pipeline;
    private final ICheckpointStore checkpointStore;

    @Override
    public <T> Mono<T> readCheckpoint(String targetTaskId, Class<T> payloadType) {
        if (!pipeline.isBefore(targetTaskId, taskId)) {
            return Mono.error(forbidden(targetTaskId));
        }
        return checkpointStore.findLatest(runId, targetTaskId)
                .switchIfEmpty(Mono.error(() -> new LedgerInvariantViolationException(
                        PaReviewInternalErrorCodes.CHECKPOINT_MISSING,
                        Map.of("runId", runId, "target", targetTaskId))))
                .map(checkpoint -> ReviewObjectMapper.getInstance().treeToValue(checkpoint.getPayload(), payloadType));
    }

    @Override
    public Mono<PriorAuthRequest> readSubmission() {
        if (!submissionReader) {
            return Mono.error(forbidden(ReviewTaskIds.SUBMISSION));
        }
        return checkpointStore.findLatest(runId, ReviewTaskIds.SUBMISSION)
                .switchIfEmpty(Mono.error(() -> new CaseInputException(
                        PaReviewInternalErrorCodes.CASE_SUBMISSION_MISSING, Map.of("runId", runId))))
                .map(checkpoint -> ReviewObjectMapper.getInstance()
                        .treeToValue(checkpoint.getPayload(), PriorAuthRequest.class));
    }

    private LedgerInvariantViolationException forbidden(String target) {
        return new LedgerInvariantViolationException(PaReviewInternalErrorCodes.CHECKPOINT_READ_FORBIDDEN,
                Map.of("taskId", taskId, "target", target));
    }
}
