package com.pareview.app.core.exception;

import com.pareview.app.core.exception.codes.PaReviewInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

/**
 * A compare-and-set on a ledger lost against another writer.
 */
@Getter
public class ConcurrentLedgerUpdateException extends PaReviewRuntimeException {

    private final String runId;
    private final long expectedRevision;
    private final long actualRevision;

    public ConcurrentLedgerUpdateException(String runId, long expectedRevision, long actualRevision) {
        super(PaReviewInternalErrorCodes.LEDGER_CONCURRENT_UPDATE, Map.of(
                "runId", runId,
                "expected", String.valueOf(expectedRevision),
                "actual", String.valueOf(actualRevision)));
        this.runId = runId;
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }
}
