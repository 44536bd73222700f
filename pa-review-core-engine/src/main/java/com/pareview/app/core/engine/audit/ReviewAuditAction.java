package com.pareview.app.core.engine.audit;

public enum ReviewAuditAction {
    RUN_CREATED,
    SUBMISSION_AMENDED,
    TASK_STARTED,
    TASK_COMPLETED,
    TASK_RECONCILED,
    TASK_FAILED,
    RUN_HALTED,
    RUN_AWAITING_REVIEW,
    RUN_RESUMED,
    HUMAN_DECISION_CONFIRMED,
    OVERRIDE_RECORDED,
    OVERRIDE_REJECTED,
    RUN_COMPLETED
}
