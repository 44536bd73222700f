package com.pareview.app.core.engine.override;

import com.pareview.app.core.engine.ReviewFixtures;
import com.pareview.app.core.engine.audit.ReviewAuditAction;
import com.pareview.app.core.engine.audit.impl.InMemoryReviewAuditService;
import com.pareview.app.core.engine.checkpoint.Checkpoint;
import com.pareview.app.core.engine.checkpoint.impl.InMemoryCheckpointStore;
import com.pareview.app.core.engine.ledger.impl.InMemoryTaskLedgerStore;
import com.pareview.app.core.engine.lock.impl.InMemoryRunLockService;
import com.pareview.app.core.engine.sequencer.ReviewPipelineDefinition;
import com.pareview.app.core.engine.sequencer.ReviewSequencer;
import com.pareview.app.core.engine.sequencer.RunOutcome;
import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.core.engine.task.impl.HumanDecisionTaskHandler;
import com.pareview.app.core.exception.OverrideValidationException;
import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.enumerations.ConfidenceTier;
import com.pareview.app.integration.enumerations.DecisionOutcome;
import com.pareview.app.integration.enumerations.TaskStatus;
import com.pareview.app.integration.models.decision.Decision;
import com.pareview.app.integration.models.task.HumanDecisionRecord;
import com.pareview.app.integration.models.task.HumanDecisionRequest;
import com.pareview.app.integration.models.task.RecommendationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HumanDecisionServiceTest {

    private static final String RUN_ID = "run-review";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:15:30Z"), ZoneOffset.UTC);

    private final InMemoryCheckpointStore checkpointStore = new InMemoryCheckpointStore();
    private final InMemoryReviewAuditService auditService = new InMemoryReviewAuditService();
    private final InMemoryRunLockService lockService = new InMemoryRunLockService();
    private ReviewSequencer sequencer;
    private HumanDecisionService service;

    private void prepare(DecisionOutcome candidate, boolean driveToReviewer) {
        sequencer = ReviewSequencer.builder()
                .pipeline(ReviewPipelineDefinition.of(List.of(
                        new CannedRecommendationHandler(candidate),
                        new HumanDecisionTaskHandler(),
                        new CannedNotificationHandler())))
                .ledgerStore(new InMemoryTaskLedgerStore())
                .checkpointStore(checkpointStore)
                .auditService(auditService)
                .lockService(lockService)
                .build();
        service = HumanDecisionService.builder()
                .sequencer(sequencer)
                .checkpointStore(checkpointStore)
                .auditService(auditService)
                .lockService(lockService)
                .clock(CLOCK)
                .build();
        sequencer.startRun(RUN_ID, ReviewFixtures.sampleRequest()).block();
        if (driveToReviewer) {
            RunOutcome outcome = sequencer.run(RUN_ID).block();
            assertEquals(RunOutcome.State.AWAITING_HUMAN_INPUT, outcome.getState());
        }
    }

    private static HumanDecisionRequest.HumanDecisionRequestBuilder decision(DecisionOutcome outcome) {
        return HumanDecisionRequest.builder()
                .finalOutcome(outcome)
                .reviewerId("md-4")
                .reviewerRole("medical-director");
    }

    private TaskStatus humanTaskStatus() {
        return sequencer.getLedger(RUN_ID).block().requireTask(ReviewTaskIds.HUMAN_DECISION).getStatus();
    }

    @Nested
    @DisplayName("Accepted decisions")
    class AcceptedTests {

        @Test
        @DisplayName("confirming the candidate completes the reviewer task and lets the run finish")
        void confirm() {
            prepare(DecisionOutcome.PEND, true);

            HumanDecisionRecord record = service.recordDecision(RUN_ID, decision(DecisionOutcome.PEND).build()).block();

            assertNull(record.getOverride());
            assertEquals(DecisionOutcome.PEND, record.getCandidateOutcome());
            assertEquals(DecisionOutcome.PEND, record.getFinalOutcome());
            assertEquals(CLOCK.instant(), record.getDecidedAt());
            assertEquals(TaskStatus.COMPLETED, humanTaskStatus());
            assertEquals(1, auditService.countByAction(ReviewAuditAction.HUMAN_DECISION_CONFIRMED));

            RunOutcome outcome = sequencer.run(RUN_ID).block();
            assertEquals(RunOutcome.State.COMPLETED, outcome.getState());
        }

        @Test
        @DisplayName("an override is stored with the candidate it replaced")
        void override() {
            prepare(DecisionOutcome.PEND, true);

            HumanDecisionRecord record = service.recordDecision(RUN_ID, decision(DecisionOutcome.APPROVE_CANDIDATE)
                    .justification("Imaging report received after intake")
                    .build()).block();

            assertEquals(DecisionOutcome.PEND, record.getOverride().getPriorOutcome());
            assertEquals(DecisionOutcome.APPROVE_CANDIDATE, record.getFinalOutcome());
            assertEquals(1, auditService.countByAction(ReviewAuditAction.OVERRIDE_RECORDED));

            Checkpoint stored = checkpointStore.findLatest(RUN_ID, ReviewTaskIds.HUMAN_DECISION).block();
            assertEquals("APPROVE_CANDIDATE", stored.getPayload().get("final_outcome").asString());
            assertEquals("PEND", stored.getPayload().get("candidate_outcome").asString());
        }
    }

    @Nested
    @DisplayName("Rejected decisions")
    class RejectedTests {

        @Test
        @DisplayName("a denial override without clinical basis leaves the candidate and the ledger untouched")
        void denialWithoutClinicalBasis() {
            prepare(DecisionOutcome.PEND, true);
            Checkpoint before = checkpointStore.findLatest(RUN_ID, ReviewTaskIds.RECOMMENDATION).block();
            long revision = sequencer.getLedger(RUN_ID).block().getRevision();

            OverrideValidationException error = assertThrows(OverrideValidationException.class,
                    () -> service.recordDecision(RUN_ID, decision(DecisionOutcome.DENY_CANDIDATE)
                            .justification("Therapy not documented")
                            .build()).block());

            assertEquals(PaReviewInternalErrorCodes.OVERRIDE_CLINICAL_BASIS_REQUIRED, error.getErrorInfo());
            assertEquals(before, checkpointStore.findLatest(RUN_ID, ReviewTaskIds.RECOMMENDATION).block());
            assertEquals(1, checkpointStore.listVersions(RUN_ID, ReviewTaskIds.RECOMMENDATION).count().block());
            assertNull(checkpointStore.findLatest(RUN_ID, ReviewTaskIds.HUMAN_DECISION).block());
            assertEquals(TaskStatus.IN_PROGRESS, humanTaskStatus());
            assertEquals(revision, sequencer.getLedger(RUN_ID).block().getRevision());
            assertEquals(1, auditService.countByAction(ReviewAuditAction.OVERRIDE_REJECTED));
            assertFalse(lockService.isLocked(RUN_ID).block());
        }

        @Test
        @DisplayName("an incomplete request is rejected before anything is read")
        void invalidRequest() {
            prepare(DecisionOutcome.PEND, true);

            OverrideValidationException error = assertThrows(OverrideValidationException.class,
                    () -> service.recordDecision(RUN_ID, decision(DecisionOutcome.PEND).reviewerId(" ").build()).block());

            assertEquals(PaReviewInternalErrorCodes.OVERRIDE_REQUEST_INVALID, error.getErrorInfo());
            assertEquals("reviewerId", error.getViolations().get(0).field());
            assertEquals(TaskStatus.IN_PROGRESS, humanTaskStatus());
        }

        @Test
        @DisplayName("a decision before the run reaches the reviewer is refused")
        void tooEarly() {
            prepare(DecisionOutcome.PEND, false);

            OverrideValidationException error = assertThrows(OverrideValidationException.class,
                    () -> service.recordDecision(RUN_ID, decision(DecisionOutcome.PEND).build()).block());

            assertEquals(PaReviewInternalErrorCodes.HUMAN_DECISION_NOT_EXPECTED, error.getErrorInfo());
        }

        @Test
        @DisplayName("a second decision after the first was recorded is refused")
        void secondDecision() {
            prepare(DecisionOutcome.APPROVE_CANDIDATE, true);
            service.recordDecision(RUN_ID, decision(DecisionOutcome.APPROVE_CANDIDATE).build()).block();

            OverrideValidationException error = assertThrows(OverrideValidationException.class,
                    () -> service.recordDecision(RUN_ID, decision(DecisionOutcome.PEND)
                            .justification("changed my mind").build()).block());

            assertEquals(PaReviewInternalErrorCodes.HUMAN_DECISION_NOT_EXPECTED, error.getErrorInfo());
            assertEquals(1, checkpointStore.listVersions(RUN_ID, ReviewTaskIds.HUMAN_DECISION).count().block());
        }
    }

    // ========================================================================
    // CANNED HANDLERS
    // ========================================================================

    private static class CannedRecommendationHandler implements IReviewTaskHandler {

        private final DecisionOutcome outcome;

        CannedRecommendationHandler(DecisionOutcome outcome) {
            this.outcome = outcome;
        }

        @Override
        public String taskId() {
            return ReviewTaskIds.RECOMMENDATION;
        }

        @Override
        public Mono<Object> execute(IReviewTaskContext context) {
            return Mono.just(RecommendationResult.builder()
                    .decision(Decision.builder()
                            .outcome(outcome)
                            .overallConfidence(72.0)
                            .confidenceTier(ConfidenceTier.MEDIUM)
                            .gaps(List.of())
                            .rationale("canned")
                            .build())
                    .summary("canned recommendation")
                    .build());
        }
    }

    private static class CannedNotificationHandler implements IReviewTaskHandler {

        @Override
        public String taskId() {
            return ReviewTaskIds.NOTIFICATION;
        }

        @Override
        public Mono<Object> execute(IReviewTaskContext context) {
            return context.readCheckpoint(ReviewTaskIds.HUMAN_DECISION, HumanDecisionRecord.class)
                    .map(record -> Map.of("final_outcome", record.getFinalOutcome().name()));
        }
    }
}
