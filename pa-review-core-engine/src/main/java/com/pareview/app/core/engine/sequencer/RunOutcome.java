package com.pareview.app.core.engine.sequencer;

import com.pareview.app.core.engine.ledger.TaskLedger;
import com.pareview.app.core.exception.PaReviewRuntimeException;
import com.pareview.app.integration.enumerations.ReviewErrorCategory;
import com.pareview.app.integration.enumerations.RunStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Where a call to drive a run stopped.
 */
@Getter
@Builder
@ToString(exclude = "ledger")
public class RunOutcome {

    public enum State {
        /** Every task completed. */
        COMPLETED,
        /** A task failed recoverably and is still in progress; resume to retry it. */
        HALTED,
        /** A reviewer task is waiting for a recorded decision. */
        AWAITING_HUMAN_INPUT
    }

    private final String runId;
    private final State state;
    private final RunStatus runStatus;
    private final String taskId;
    private final String errorCode;
    private final ReviewErrorCategory errorCategory;
    private final String errorMessage;
    private final String resolution;
    private final TaskLedger ledger;

    public static RunOutcome completed(TaskLedger ledger) {
        return RunOutcome.builder()
                .runId(ledger.getRunId())
                .state(State.COMPLETED)
                .runStatus(ledger.getStatus())
                .ledger(ledger)
                .build();
    }

    public static RunOutcome awaitingHumanInput(TaskLedger ledger, String taskId) {
        return RunOutcome.builder()
                .runId(ledger.getRunId())
                .state(State.AWAITING_HUMAN_INPUT)
                .runStatus(ledger.getStatus())
                .taskId(taskId)
                .ledger(ledger)
                .build();
    }

    public static RunOutcome halted(TaskLedger ledger, String taskId, PaReviewRuntimeException error) {
        return RunOutcome.builder()
                .runId(ledger.getRunId())
                .state(State.HALTED)
                .runStatus(ledger.getStatus())
                .taskId(taskId)
                .errorCode(error.getErrorInfo().getErrorCode())
                .errorCategory(error.getCategory())
                .errorMessage(error.getMessage())
                .resolution(error.getResolution())
                .ledger(ledger)
                .build();
    }
}
