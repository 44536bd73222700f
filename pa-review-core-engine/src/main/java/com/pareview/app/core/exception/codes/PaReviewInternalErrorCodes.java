package com.pareview.app.core.exception.codes;

import com.pareview.app.integration.contract.IPaReviewErrorInfo;
import com.pareview.app.integration.enumerations.ReviewErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum PaReviewInternalErrorCodes implements IPaReviewErrorInfo {

    // ========================================================================
    // INPUT
    // ========================================================================

    CASE_INPUT_CONSTRAINT_VIOLATION(
            "PAREVIEW_ERR_0001",
            ReviewErrorCategory.INPUT,
            "Case {caseId} failed validation: {violations}",
            "Correct the listed fields and resubmit the case"
    ),

    CASE_SUBMISSION_MISSING(
            "PAREVIEW_ERR_0002",
            ReviewErrorCategory.INPUT,
            "No submission stored for run {runId}",
            "Submit the case before running the review"
    ),

    CASE_SUBMISSION_LOCKED(
            "PAREVIEW_ERR_0003",
            ReviewErrorCategory.INPUT,
            "Submission for run {runId} can no longer be amended, intake is {status}",
            "Start a new run for the corrected case"
    ),

    POLICY_CRITERIA_EMPTY(
            "PAREVIEW_ERR_0004",
            ReviewErrorCategory.INPUT,
            "Policy {policyId} supplied no criteria to evaluate",
            "Supply at least one criterion or route the case to manual policy review"
    ),

    RUN_NOT_FOUND(
            "PAREVIEW_ERR_0005",
            ReviewErrorCategory.INPUT,
            "Run {runId} does not exist",
            "Check the run identifier"
    ),

    // ========================================================================
    // COLLABORATOR / EXECUTION
    // ========================================================================

    COLLABORATOR_UNAVAILABLE(
            "PAREVIEW_ERR_0101",
            ReviewErrorCategory.COLLABORATOR,
            "Collaborator {collaborator} unavailable during task {taskId}: {reason}",
            "Resume the run once the collaborator is reachable"
    ),

    TASK_EXECUTION_FAILED(
            "PAREVIEW_ERR_0102",
            ReviewErrorCategory.EXECUTION,
            "Task {taskId} of run {runId} failed: {reason}",
            "Resume the run to retry the task from scratch"
    ),

    TASK_TIMED_OUT(
            "PAREVIEW_ERR_0103",
            ReviewErrorCategory.EXECUTION,
            "Task {taskId} of run {runId} exceeded its time budget of {timeout}",
            "Resume the run to retry the task from scratch"
    ),

    LEDGER_CONCURRENT_UPDATE(
            "PAREVIEW_ERR_0104",
            ReviewErrorCategory.EXECUTION,
            "Ledger of run {runId} changed concurrently, expected revision {expected} but found {actual}",
            "Reload the ledger and retry"
    ),

    RUN_LOCKED(
            "PAREVIEW_ERR_0105",
            ReviewErrorCategory.EXECUTION,
            "Run {runId} is being driven by another owner",
            "Wait for the current driver to finish"
    ),

    // ========================================================================
    // HUMAN INPUT / OVERRIDE
    // ========================================================================

    AWAITING_HUMAN_DECISION(
            "PAREVIEW_ERR_0201",
            ReviewErrorCategory.HUMAN_INPUT,
            "Run {runId} is waiting for a reviewer decision on task {taskId}",
            "Record the reviewer decision, then resume the run"
    ),

    HUMAN_DECISION_NOT_EXPECTED(
            "PAREVIEW_ERR_0202",
            ReviewErrorCategory.OVERRIDE,
            "Run {runId} is not waiting for a reviewer decision, task {taskId} is {status}",
            "Run the review until it stops for reviewer input"
    ),

    OVERRIDE_REQUEST_INVALID(
            "PAREVIEW_ERR_0203",
            ReviewErrorCategory.OVERRIDE,
            "Reviewer decision for run {runId} failed validation: {violations}",
            "Complete the listed fields"
    ),

    OVERRIDE_JUSTIFICATION_REQUIRED(
            "PAREVIEW_ERR_0204",
            ReviewErrorCategory.OVERRIDE,
            "Changing {prior} to {final} requires a justification",
            "Provide a justification for the override"
    ),

    OVERRIDE_CLINICAL_BASIS_REQUIRED(
            "PAREVIEW_ERR_0205",
            ReviewErrorCategory.OVERRIDE,
            "Changing {prior} to {final} moves into or out of a denial and requires a clinical basis",
            "Provide the clinical basis for the override"
    ),

    // ========================================================================
    // INVARIANT
    // ========================================================================

    LEDGER_MULTIPLE_IN_PROGRESS(
            "PAREVIEW_ERR_0301",
            ReviewErrorCategory.INVARIANT,
            "Run {runId} has more than one task in progress: {tasks}",
            "Ledger is corrupt, inspect the run before any further processing"
    ),

    LEDGER_ORDER_VIOLATION(
            "PAREVIEW_ERR_0302",
            ReviewErrorCategory.INVARIANT,
            "Run {runId} has task {taskId} in status {status} after an unfinished task",
            "Ledger is corrupt, inspect the run before any further processing"
    ),

    LEDGER_ILLEGAL_TRANSITION(
            "PAREVIEW_ERR_0303",
            ReviewErrorCategory.INVARIANT,
            "Task {taskId} of run {runId} cannot move from {from} to {to}",
            "Only forward transitions are permitted"
    ),

    LEDGER_UNKNOWN_TASK(
            "PAREVIEW_ERR_0304",
            ReviewErrorCategory.INVARIANT,
            "Run {runId} has no task {taskId}",
            "Check the pipeline definition"
    ),

    LEDGER_ALREADY_EXISTS(
            "PAREVIEW_ERR_0305",
            ReviewErrorCategory.INVARIANT,
            "A ledger already exists for run {runId}",
            "Run identifiers must be unique"
    ),

    CHECKPOINT_READ_FORBIDDEN(
            "PAREVIEW_ERR_0306",
            ReviewErrorCategory.INVARIANT,
            "Task {taskId} may not read {target}, only checkpoints of earlier tasks",
            "Read only checkpoints of tasks earlier in the pipeline"
    ),

    CHECKPOINT_MISSING(
            "PAREVIEW_ERR_0307",
            ReviewErrorCategory.INVARIANT,
            "Completed task {target} of run {runId} has no checkpoint",
            "Checkpoint store is incomplete, inspect the run"
    ),

    PIPELINE_DEFINITION_INVALID(
            "PAREVIEW_ERR_0308",
            ReviewErrorCategory.INVARIANT,
            "Review pipeline definition is invalid: {reason}",
            "Fix the pipeline definition"
    ),

    CONFIDENCE_WEIGHTS_INVALID(
            "PAREVIEW_ERR_0309",
            ReviewErrorCategory.INVARIANT,
            "Confidence weights must sum to 1.0 but sum to {sum}",
            "Adjust the weights so they sum to 1.0"
    ),

    CONFIGURATION_INVALID(
            "PAREVIEW_ERR_0310",
            ReviewErrorCategory.INVARIANT,
            "Configuration value {key} is invalid: {reason}",
            "Fix the configuration value"
    ),

    // ========================================================================
    // DECISION POLICY
    // ========================================================================

    DECISION_OUTCOME_NOT_PERMITTED(
            "PAREVIEW_ERR_0401",
            ReviewErrorCategory.DECISION_POLICY,
            "Resolver configuration is not permitted: {reason}",
            "Enable strict denial explicitly before allowing DENY_CANDIDATE"
    )

    ;

    private final String errorCode;
    private final ReviewErrorCategory category;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
