package com.pareview.app.core.engine.notification.impl;

import com.pareview.app.core.engine.notification.IReviewNotificationService;
import com.pareview.app.core.engine.notification.ReviewNotificationEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Writes notifications to the log and keeps them per run. Used when no delivery channel is wired.
 */
@Slf4j
public class LoggingReviewNotificationService implements IReviewNotificationService {

    private final Map<String, List<ReviewNotificationEvent>> sent = new ConcurrentHashMap<>();

    @Override
    public Mono<DeliveryResult> notify(ReviewNotificationEvent event) {
        return Mono.fromCallable(() -> {
            List<String> delivered = new ArrayList<>();
            for (String channel : event.getChannels()) {
                log.info("Notification sent: runId={}, caseId={}, channel={}, outcome={}, overridden={}",
                        event.getRunId(), event.getCaseId(), channel, event.getFinalOutcome(), event.isOverridden());
                delivered.add(channel);
            }
            sent.computeIfAbsent(event.getRunId(), key -> new CopyOnWriteArrayList<>()).add(event);
            return new DeliveryResult(List.copyOf(delivered), List.of());
        });
    }

    public List<ReviewNotificationEvent> getSent(String runId) {
        return List.copyOf(sent.getOrDefault(runId, List.of()));
    }
}
