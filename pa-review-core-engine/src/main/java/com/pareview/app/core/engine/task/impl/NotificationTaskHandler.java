package com.pareview.app.core.engine.task.impl;

import com.pareview.app.core.engine.notification.IReviewNotificationService;
import com.pareview.app.core.engine.notification.ReviewNotificationEvent;
import com.pareview.app.core.engine.task.IReviewTaskContext;
import com.pareview.app.core.engine.task.IReviewTaskHandler;
import com.pareview.app.integration.collaborator.IReviewReportFormatter;
import com.pareview.app.integration.constant.ReviewTaskIds;
import com.pareview.app.integration.models.task.EvidenceMappingResult;
import com.pareview.app.integration.models.task.HumanDecisionRecord;
import com.pareview.app.integration.models.task.NotificationResult;
import com.pareview.app.integration.models.task.RecommendationResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Renders the report and delivers the reviewer's final outcome.
 *
 * <p>Delivery failures are recorded on the checkpoint. The run still completes, since the decision
 * itself is already final.</p>
 */
@Slf4j
public class NotificationTaskHandler implements IReviewTaskHandler {

    private final IReviewReportFormatter formatter;
    private final IReviewNotificationService notificationService;
    private final List<String> channels;
    private final Clock clock;

    public NotificationTaskHandler(IReviewReportFormatter formatter,
                                   IReviewNotificationService notificationService,
                                   List<String> channels,
                                   Clock clock) {
        this.formatter = formatter;
        this.notificationService = notificationService;
        this.channels = channels == null || channels.isEmpty() ? List.of("provider", "member") : List.copyOf(channels);
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public String taskId() {
        return ReviewTaskIds.NOTIFICATION;
    }

    @Override
    public Mono<Object> execute(IReviewTaskContext context) {
        return Mono.zip(context.readCheckpoint(ReviewTaskIds.EVIDENCE_MAPPING, EvidenceMappingResult.class),
                        context.readCheckpoint(ReviewTaskIds.RECOMMENDATION, RecommendationResult.class),
                        context.readCheckpoint(ReviewTaskIds.HUMAN_DECISION, HumanDecisionRecord.class))
                .flatMap(inputs -> {
                    HumanDecisionRecord decision = inputs.getT3();
                    String report = formatter.format(context.getCaseId(), inputs.getT2(), inputs.getT1(), decision);
                    ReviewNotificationEvent event = ReviewNotificationEvent.builder()
                            .runId(context.getRunId())
                            .caseId(context.getCaseId())
                            .finalOutcome(decision.getFinalOutcome())
                            .overridden(decision.getOverride() != null)
                            .decidedBy(decision.getDecidedBy())
                            .report(report)
                            .channels(channels)
                            .createdAt(clock.instant())
                            .build();
                    return notificationService.notify(event)
                            .onErrorResume(error -> {
                                log.warn("Notification delivery failed: runId={}, error={}", context.getRunId(), error.toString());
                                return Mono.just(new IReviewNotificationService.DeliveryResult(List.of(), channels));
                            })
                            .map(delivery -> NotificationResult.builder()
                                    .finalOutcome(decision.getFinalOutcome())
                                    .report(report)
                                    .deliveredChannels(delivery.delivered())
                                    .failedChannels(delivery.failed())
                                    .sentAt(clock.instant())
                                    .build());
                });
    }
}
