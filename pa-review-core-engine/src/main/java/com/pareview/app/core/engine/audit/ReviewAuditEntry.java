package com.pareview.app.core.engine.audit;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.pareview.app.integration.enumerations.ReviewActorType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One immutable entry of a run's audit trail. Created through the static factories, one per action.
 * The private no-arg constructor is for reading persisted trails back.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReviewAuditEntry {

    private String entryId;
    private String runId;
    private String caseId;
    private String taskId;
    private ReviewAuditAction action;
    private ReviewActorType actorType;
    private String actorId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;
    private String description;
    private Map<String, Object> details;

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static ReviewAuditEntry runCreated(String runId, String caseId, int taskCount) {
        return system(runId, caseId, null, ReviewAuditAction.RUN_CREATED,
                "Run created for case " + caseId,
                Map.of("taskCount", taskCount));
    }

    public static ReviewAuditEntry submissionAmended(String runId, String caseId, int submissionVersion) {
        return base(runId, caseId, null, ReviewAuditAction.SUBMISSION_AMENDED)
                .actorType(ReviewActorType.OPERATOR)
                .description("Submission amended, now at version " + submissionVersion)
                .details(Map.of("submissionVersion", submissionVersion))
                .build();
    }

    public static ReviewAuditEntry taskStarted(String runId, String caseId, String taskId) {
        return system(runId, caseId, taskId, ReviewAuditAction.TASK_STARTED, "Task started", Map.of());
    }

    public static ReviewAuditEntry taskCompleted(String runId, String caseId, String taskId, int checkpointVersion) {
        return system(runId, caseId, taskId, ReviewAuditAction.TASK_COMPLETED,
                "Task completed with checkpoint version " + checkpointVersion,
                Map.of("checkpointVersion", checkpointVersion));
    }

    public static ReviewAuditEntry taskReconciled(String runId, String caseId, String taskId, int checkpointVersion) {
        return system(runId, caseId, taskId, ReviewAuditAction.TASK_RECONCILED,
                "Task marked completed from existing checkpoint version " + checkpointVersion,
                Map.of("checkpointVersion", checkpointVersion));
    }

    public static ReviewAuditEntry taskFailed(String runId, String caseId, String taskId,
                                              String errorCategory, String errorMessage) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errorCategory", errorCategory);
        details.put("errorMessage", errorMessage);
        return system(runId, caseId, taskId, ReviewAuditAction.TASK_FAILED, "Task failed: " + errorMessage, details);
    }

    public static ReviewAuditEntry runHalted(String runId, String caseId, String taskId) {
        return system(runId, caseId, taskId, ReviewAuditAction.RUN_HALTED,
                "Run halted, resumable at task " + taskId, Map.of());
    }

    public static ReviewAuditEntry awaitingReview(String runId, String caseId, String taskId) {
        return system(runId, caseId, taskId, ReviewAuditAction.RUN_AWAITING_REVIEW,
                "Run waiting for reviewer decision", Map.of());
    }

    public static ReviewAuditEntry runResumed(String runId, String caseId, String nextTaskId, long completed, long remaining) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("completed", completed);
        details.put("remaining", remaining);
        if (nextTaskId != null) {
            details.put("nextTaskId", nextTaskId);
        }
        return base(runId, caseId, nextTaskId, ReviewAuditAction.RUN_RESUMED)
                .actorType(ReviewActorType.OPERATOR)
                .description("Run resumed with " + completed + " completed and " + remaining + " remaining tasks")
                .details(details)
                .build();
    }

    public static ReviewAuditEntry decisionConfirmed(String runId, String caseId, String taskId,
                                                     String reviewerId, String outcome) {
        return reviewer(runId, caseId, taskId, reviewerId, ReviewAuditAction.HUMAN_DECISION_CONFIRMED,
                "Reviewer confirmed candidate outcome " + outcome,
                Map.of("finalOutcome", outcome));
    }

    public static ReviewAuditEntry overrideRecorded(String runId, String caseId, String taskId, String reviewerId,
                                                    String priorOutcome, String finalOutcome) {
        return reviewer(runId, caseId, taskId, reviewerId, ReviewAuditAction.OVERRIDE_RECORDED,
                "Reviewer overrode " + priorOutcome + " with " + finalOutcome,
                Map.of("priorOutcome", priorOutcome, "finalOutcome", finalOutcome));
    }

    public static ReviewAuditEntry overrideRejected(String runId, String caseId, String taskId, String reviewerId,
                                                    String reason) {
        return reviewer(runId, caseId, taskId, reviewerId, ReviewAuditAction.OVERRIDE_REJECTED,
                "Reviewer decision rejected: " + reason, Map.of());
    }

    public static ReviewAuditEntry runCompleted(String runId, String caseId) {
        return system(runId, caseId, null, ReviewAuditAction.RUN_COMPLETED, "All tasks completed", Map.of());
    }

    private static ReviewAuditEntry system(String runId, String caseId, String taskId, ReviewAuditAction action,
                                           String description, Map<String, Object> details) {
        return base(runId, caseId, taskId, action)
                .actorType(ReviewActorType.SYSTEM)
                .actorId("system")
                .description(description)
                .details(details)
                .build();
    }

    private static ReviewAuditEntry reviewer(String runId, String caseId, String taskId, String reviewerId,
                                             ReviewAuditAction action, String description,
                                             Map<String, Object> details) {
        return base(runId, caseId, taskId, action)
                .actorType(ReviewActorType.REVIEWER)
                .actorId(reviewerId)
                .description(description)
                .details(details)
                .build();
    }

    private static ReviewAuditEntryBuilder base(String runId, String caseId, String taskId, ReviewAuditAction action) {
        return ReviewAuditEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .runId(runId)
                .caseId(caseId)
                .taskId(taskId)
                .action(action)
                .timestamp(Instant.now());
    }
}
