package com.pareview.app.core.engine.notification;

import com.pareview.app.integration.enumerations.DecisionOutcome;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Final outcome of a case, ready to be delivered to the requesting provider and the plan.
 */
@Getter
@Builder
@ToString(exclude = "report")
public class ReviewNotificationEvent {

    private final String runId;
    private final String caseId;
    private final DecisionOutcome finalOutcome;
    private final boolean overridden;
    private final String decidedBy;
    private final String report;
    private final List<String> channels;
    private final Instant createdAt;
}
