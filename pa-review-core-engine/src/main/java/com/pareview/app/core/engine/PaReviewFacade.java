package com.pareview.app.core.engine;

import com.pareview.app.core.engine.audit.IReviewAuditService;
import com.pareview.app.core.engine.audit.ReviewAuditEntry;
import com.pareview.app.core.engine.audit.impl.FileBasedReviewAuditService;
import com.pareview.app.core.engine.audit.impl.InMemoryReviewAuditService;
import com.pareview.app.core.engine.checkpoint.ICheckpointStore;
import com.pareview.app.core.engine.checkpoint.impl.FileBasedCheckpointStore;
import com.pareview.app.core.engine.checkpoint.impl.InMemoryCheckpointStore;
import com.pareview.app.core.engine.confidence.ConfidenceAggregator;
import com.pareview.app.core.engine.config.ReviewEngineConfig;
import com.pareview.app.core.engine.decision.DecisionResolver;
import com.pareview.app.core.engine.evaluation.CriterionEvaluator;
import com.pareview.app.core.engine.evaluation.IEvidenceMatcher;
import com.pareview.app.core.engine.evaluation.impl.ScopeTermEvidenceMatcher;
import com.pareview.app.core.engine.ledger.ITaskLedgerStore;
import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.engine.ledger.impl.FileBasedTaskLedgerStore;
import com.pareview.app.core.engine.ledger.impl.InMemoryTaskLedgerStore;
import com.pareview.app.core.engine.lock.IReviewRunLockService;
import com.pareview.app.core.engine.lock.impl.InMemoryRunLockService;
import com.pareview.app.core.engine.misc.ReviewObjectMapper;
import com.pareview.app.core.engine.notification.IReviewNotificationService;
import com.pareview.app.core.engine.notification.impl.LoggingReviewNotificationService;
import com.pareview.app.core.engine.override.HumanDecisionService;
import com.pareview.app.core.engine.report.SummaryReportFormatter;
import com.pareview.app.core.engine.sequencer.IReviewSequencer;
import com.pareview.app.core.engine.sequencer.ResumeSummary;
import com.pareview.app.core.engine.sequencer.ReviewPipelineDefinition;
import com.pareview.app.core.engine.sequencer.ReviewSequencer;
import com.pareview.app.core.engine.sequencer.RunOutcome;
import com.pareview.app.core.engine.task.impl.ComplianceTaskHandler;
import com.pareview.app.core.engine.task.impl.EvidenceMappingTaskHandler;
import com.pareview.app.core.engine.task.impl.HumanDecisionTaskHandler;
import com.pareview.app.core.engine.task.impl.IntakeTaskHandler;
import com.pareview.app.core.engine.task.impl.NotificationTaskHandler;
import com.pareview.app.core.engine.task.impl.PolicyRetrievalTaskHandler;
import com.pareview.app.core.engine.task.impl.RecommendationTaskHandler;
import com.pareview.app.integration.collaborator.ICodeValidationClient;
import com.pareview.app.integration.collaborator.IPolicySearchClient;
import com.pareview.app.integration.collaborator.IProviderVerificationClient;
import com.pareview.app.integration.collaborator.IReviewReportFormatter;
import com.pareview.app.integration.models.request.PriorAuthRequest;
import com.pareview.app.integration.models.task.HumanDecisionRecord;
import com.pareview.app.integration.models.task.HumanDecisionRequest;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Wires the review pipeline from an engine configuration and the external collaborators.
 *
 * <pre>{@code
 * IPaReviewFacade facade = PaReviewFacade.builder()
 *         .config(ReviewEngineConfig.fromEnvironment())
 *         .providerClient(registry)
 *         .codeClient(codes)
 *         .policyClient(policies)
 *         .build();
 * facade.initialize().block();
 * RunOutcome outcome = facade.submitAndRun(request).block();
 * }</pre>
 */
@Slf4j
public class PaReviewFacade implements IPaReviewFacade {

    private final ReviewEngineConfig config;
    private final ITaskLedgerStore ledgerStore;
    private final ICheckpointStore checkpointStore;
    private final IReviewAuditService auditService;
    private final IReviewRunLockService lockService;
    private final ReviewSequencer sequencer;
    private final HumanDecisionService humanDecisionService;

    @Builder
    public PaReviewFacade(ReviewEngineConfig config,
                          IProviderVerificationClient providerClient,
                          ICodeValidationClient codeClient,
                          IPolicySearchClient policyClient,
                          IReviewReportFormatter reportFormatter,
                          IReviewNotificationService notificationService,
                          List<String> notificationChannels,
                          IEvidenceMatcher evidenceMatcher,
                          ITaskLedgerStore ledgerStore,
                          ICheckpointStore checkpointStore,
                          IReviewAuditService auditService,
                          IReviewRunLockService lockService,
                          Clock clock) {
        this.config = config != null ? config : ReviewEngineConfig.defaults();
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
        this.ledgerStore = ledgerStore != null ? ledgerStore : createLedgerStore(this.config);
        this.checkpointStore = checkpointStore != null ? checkpointStore : createCheckpointStore(this.config, effectiveClock);
        this.auditService = auditService != null ? auditService : createAuditService(this.config);
        this.lockService = lockService != null ? lockService : new InMemoryRunLockService(this.config.getLockDuration());

        ReviewPipelineDefinition pipeline = ReviewPipelineDefinition.of(List.of(
                new IntakeTaskHandler(),
                ComplianceTaskHandler.builder()
                        .providerClient(Objects.requireNonNull(providerClient, "providerClient"))
                        .codeClient(Objects.requireNonNull(codeClient, "codeClient"))
                        .requiredDocumentationCategories(this.config.getRequiredDocumentationCategories())
                        .demoProviderIds(this.config.getDemoProviderIds())
                        .collaboratorTimeout(this.config.getCollaboratorTimeout())
                        .build(),
                new PolicyRetrievalTaskHandler(Objects.requireNonNull(policyClient, "policyClient"),
                        this.config.getMinimumPolicyRelevance(), this.config.getCollaboratorTimeout()),
                new EvidenceMappingTaskHandler(new CriterionEvaluator(
                        evidenceMatcher != null ? evidenceMatcher : new ScopeTermEvidenceMatcher())),
                new RecommendationTaskHandler(new ConfidenceAggregator(this.config.getWeights()),
                        new DecisionResolver(this.config.getResolverConfig())),
                new HumanDecisionTaskHandler(),
                new NotificationTaskHandler(
                        reportFormatter != null ? reportFormatter : new SummaryReportFormatter(),
                        notificationService != null ? notificationService : new LoggingReviewNotificationService(),
                        notificationChannels,
                        effectiveClock)));

        this.sequencer = ReviewSequencer.builder()
                .pipeline(pipeline)
                .ledgerStore(this.ledgerStore)
                .checkpointStore(this.checkpointStore)
                .auditService(this.auditService)
                .lockService(this.lockService)
                .taskTimeout(this.config.getTaskTimeout())
                .lockDuration(this.config.getLockDuration())
                .clock(effectiveClock)
                .build();

        this.humanDecisionService = HumanDecisionService.builder()
                .sequencer(sequencer)
                .checkpointStore(this.checkpointStore)
                .auditService(this.auditService)
                .lockService(this.lockService)
                .lockDuration(this.config.getLockDuration())
                .clock(effectiveClock)
                .build();
    }

    @Override
    public Mono<Void> initialize() {
        return ledgerStore.initialize()
                .then(checkpointStore.initialize())
                .then(auditService.initialize())
                .doOnSuccess(v -> log.info("Review engine initialized: storeType={}", config.getStoreType()));
    }

    @Override
    public Mono<Void> shutdown() {
        return ledgerStore.shutdown()
                .then(checkpointStore.shutdown())
                .then(auditService.shutdown())
                .doOnSuccess(v -> log.info("Review engine shut down"));
    }

    @Override
    public Mono<String> submit(PriorAuthRequest request) {
        return Mono.defer(() -> sequencer.startRun(UUID.randomUUID().toString(), request))
                .map(TaskLedger::getRunId);
    }

    @Override
    public Mono<RunOutcome> run(String runId) {
        return sequencer.run(runId);
    }

    @Override
    public Mono<RunOutcome> submitAndRun(PriorAuthRequest request) {
        return submit(request).flatMap(this::run);
    }

    @Override
    public Mono<ResumeSummary> resume(String runId) {
        return sequencer.resume(runId);
    }

    @Override
    public Mono<TaskLedger> amendSubmission(String runId, PriorAuthRequest request) {
        return sequencer.amendSubmission(runId, request);
    }

    @Override
    public Mono<HumanDecisionRecord> recordHumanDecision(String runId, HumanDecisionRequest request) {
        return humanDecisionService.recordDecision(runId, request);
    }

    @Override
    public Flux<ReviewAuditEntry> getAuditTrail(String runId) {
        return auditService.getTrail(runId);
    }

    @Override
    public <T> Mono<T> readCheckpoint(String runId, String taskId, Class<T> payloadType) {
        return checkpointStore.findLatest(runId, taskId)
                .map(checkpoint -> ReviewObjectMapper.getInstance().treeToValue(checkpoint.getPayload(), payloadType));
    }

    @Override
    public Mono<TaskLedger> getLedger(String runId) {
        return sequencer.getLedger(runId);
    }

    @Override
    public IReviewSequencer getSequencer() {
        return sequencer;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private static ITaskLedgerStore createLedgerStore(ReviewEngineConfig config) {
        return switch (config.getStoreType()) {
            case MEMORY -> new InMemoryTaskLedgerStore();
            case FILE -> new FileBasedTaskLedgerStore(config.getStorePath());
        };
    }

    private static IReviewAuditService createAuditService(ReviewEngineConfig config) {
        return switch (config.getStoreType()) {
            case MEMORY -> new InMemoryReviewAuditService();
            case FILE -> new FileBasedReviewAuditService(config.getStorePath());
        };
    }

    private static ICheckpointStore createCheckpointStore(ReviewEngineConfig config, Clock clock) {
        return switch (config.getStoreType()) {
            case MEMORY -> new InMemoryCheckpointStore(clock);
            case FILE -> new FileBasedCheckpointStore(config.getStorePath(), clock);
        };
    }
}
