package com.pareview.app.core.engine.override;

import com.pareview.app.core.engine.audit.IReviewAuditService;
import com.pareview.app.core.engine.audit.ReviewAuditEntry;
import com.pareview.app.core.engine.checkpoint.ICheckpointStore;
import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.ledger.TaskRecord;
import com.pareview.app.core.engine.lock.IReviewRunLockService;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import com.pareview.app.core.engine.sequencer.IReviewSequencer;
import com.pareview.app.core.engine.validation.ReviewBeanValidator;
import com.pareview.app.core.exception.LedgerInvariantViolationException;
import com.pareview.app.core.exception.OverrideValidationException;
import com.pareview.app.core.exception.ReviewConstraintViolation;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import com.pareview.app.integration.enumerations.TaskStatus;
import com.pareview.app.integration.models.decision.DecisionOverride;
import com.pareview.app.integration.models.task.HumanDecisionRecord;
import com.pareview.app.integration.models.task.HumanDecisionRequest;
import com.pareview.app.integration.models.task.RecommendationResult;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Closes the human-decision task with a reviewer's confirmation or override.
 *
 * <p>The decision is checked against the frozen recommendation checkpoint; nothing is
 * re-evaluated. A rejected decision writes nothing but an audit entry, so the candidate decision
 * and the ledger stay as they were.</p>
 */
@Slf4j
public class HumanDecisionService {

    private final IReviewSequencer sequencer;
    private final ICheckpointStore checkpointStore;
    private final IReviewAuditService auditService;
    private final IReviewRunLockService lockService;
    private final Duration lockDuration;
    private final Clock clock;
    private final String humanTaskId;
    private final String recommendationTaskId;

    @Builder
    public HumanDecisionService(IReviewSequencer sequencer,
                                ICheckpointStore checkpointStore,
                                IReviewAuditService auditService,
                                IReviewRunLockService lockService,
                                Duration lockDuration,
                                Clock clock,
                                String humanTaskId,
                                String recommendationTaskId) {
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.auditService = Objects.requireNonNull(auditService, "auditService");
        this.lockService = Objects.requireNonNull(lockService, "lockService");
        this.lockDuration = lockDuration != null ? lockDuration : Duration.ofMinutes(5);
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.humanTaskId = humanTaskId != null ? humanTaskId : ReviewTaskIds.HUMAN_DECISION;
        this.recommendationTaskId = recommendationTaskId != null ? recommendationTaskId : ReviewTaskIds.RECOMMENDATION;
    }

    public Mono<HumanDecisionRecord> recordDecision(String runId, HumanDecisionRequest request) {
        Objects.requireNonNull(runId, "runId");
        List<ReviewConstraintViolation> violations = ReviewBeanValidator.getInstance().validate(request);
        if (!violations.isEmpty()) {
            return Mono.error(new OverrideValidationException(PaReviewInternalErrorCodes.OVERRIDE_REQUEST_INVALID,
                    Map.of("runId", runId, "violations", violations.stream()
                            .map(ReviewConstraintViolation::toString)
                            .collect(Collectors.joining("; "))),
                    violations));
        }
        String ownerId = "reviewer-" + request.getReviewerId();
        return lockService.executeWithLock(runId, ownerId, lockDuration, "human-decision",
                () -> sequencer.getLedger(runId).flatMap(ledger -> decide(ledger, request)));
    }

    private Mono<HumanDecisionRecord> decide(TaskLedger ledger, HumanDecisionRequest request) {
        String runId = ledger.getRunId();
        TaskRecord task = ledger.requireTask(humanTaskId);
        if (task.getStatus() != TaskStatus.IN_PROGRESS) {
            return Mono.error(new OverrideValidationException(PaReviewInternalErrorCodes.HUMAN_DECISION_NOT_EXPECTED,
                    Map.of("runId", runId, "taskId", humanTaskId, "status", task.getStatus().toWireValue())));
        }
        return checkpointStore.findLatest(runId, recommendationTaskId)
                .switchIfEmpty(Mono.error(() -> new LedgerInvariantViolationException(
                        PaReviewInternalErrorCodes.CHECKPOINT_MISSING,
                        Map.of("runId", runId, "target", recommendationTaskId))))
                .map(checkpoint -> ReviewObjectMapper.getInstance()
                        .treeToValue(checkpoint.getPayload(), RecommendationResult.class))
                .flatMap(recommendation -> {
                    DecisionOutcome candidate = recommendation.getDecision().getOutcome();
                    Instant now = clock.instant();
                    DecisionOverride override;
                    try {
                        override = OverrideValidator.validate(candidate, request, now);
                    } catch (OverrideValidationException rejected) {
                        log.warn("Reviewer decision rejected: runId={}, reviewer={}, error={}",
                                runId, request.getReviewerId(), rejected.getMessage());
                        return auditService.record(ReviewAuditEntry.overrideRejected(runId, ledger.getCaseId(),
                                        humanTaskId, request.getReviewerId(), rejected.getMessage()))
                                .then(Mono.<HumanDecisionRecord>error(rejected));
                    }
                    HumanDecisionRecord record = HumanDecisionRecord.builder()
                            .candidateOutcome(candidate)
                            .finalOutcome(request.getFinalOutcome())
                            .override(override)
                            .decidedBy(request.getReviewerId())
                            .reviewerRole(request.getReviewerRole())
                            .notes(request.getNotes())
                            .decidedAt(now)
                            .build();
                    return sequencer.complete(runId, humanTaskId, record)
                            .then(auditService.record(auditEntry(ledger, record)))
                            .doOnNext(entry -> log.info("Human decision recorded: runId={}, reviewer={}, candidate={}, final={}",
                                    runId, record.getDecidedBy(), candidate, record.getFinalOutcome()))
                            .thenReturn(record);
                });
    }

    private ReviewAuditEntry auditEntry(TaskLedger ledger, HumanDecisionRecord record) {
        if (record.getOverride() == null) {
            return ReviewAuditEntry.decisionConfirmed(ledger.getRunId(), ledger.getCaseId(), humanTaskId,
                    record.getDecidedBy(), record.getFinalOutcome().name());
        }
        return ReviewAuditEntry.overrideRecorded(ledger.getRunId(), ledger.getCaseId(), humanTaskId,
                record.getDecidedBy(), record.getCandidateOutcome().name(), record.getFinalOutcome().name());
    }
}
