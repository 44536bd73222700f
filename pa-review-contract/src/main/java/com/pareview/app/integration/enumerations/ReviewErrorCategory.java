package com.pareview.app.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Classes of failure a review run can encounter.
 *
 * <p>Recoverable categories halt the current task and leave the run resumable.
 * Non-recoverable categories indicate programming or configuration errors and abort the caller.</p>
 */
@Getter
@AllArgsConstructor
public enum ReviewErrorCategory {

    /** Malformed or missing case fields. */
    INPUT(true),

    /** External lookup unavailable or timed out. */
    COLLABORATOR(true),

    /** The run is waiting on a reviewer. */
    HUMAN_INPUT(true),

    /** A reviewer decision failed validation. */
    OVERRIDE(true),

    /** Task failed or exceeded its time budget for any other reason. */
    EXECUTION(true),

    /** Ledger or configuration invariant broken. */
    INVARIANT(false),

    /** Resolver configured to emit an outcome it may not emit. */
    DECISION_POLICY(false);

    private final boolean recoverable;
}
