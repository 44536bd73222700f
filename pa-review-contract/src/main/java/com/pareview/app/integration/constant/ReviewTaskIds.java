package com.pareview.app.integration.constant;

import java.util.List;

/**
 * Identifiers of the review pipeline tasks, in execution order.
 */
public final class ReviewTaskIds {

    /** Reserved checkpoint key under which submitted requests are stored. Not a task. */
    public static final String SUBMISSION = "submission";

    public static final String INTAKE = "intake";
    public static final String COMPLIANCE = "compliance";
    public static final String POLICY_RETRIEVAL = "policy-retrieval";
    public static final String EVIDENCE_MAPPING = "evidence-mapping";
    public static final String RECOMMENDATION = "recommendation";
    public static final String HUMAN_DECISION = "human-decision";
    public static final String NOTIFICATION = "notification";

    public static final List<String> ORDER = List.of(
            INTAKE,
            COMPLIANCE,
            POLICY_RETRIEVAL,
            EVIDENCE_MAPPING,
            RECOMMENDATION,
            HUMAN_DECISION,
            NOTIFICATION
    );

    private ReviewTaskIds() {
    }
}
