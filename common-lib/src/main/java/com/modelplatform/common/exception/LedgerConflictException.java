package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

/**
 * The ledger head no longer matched the identifier read at the start of evaluation.
 * Under single-flight execution this indicates a lock-discipline bug elsewhere.
 */
public class LedgerConflictException extends RetrainingException {
    private final String expectedPriorId;
    private final String actualHeadId;

    public LedgerConflictException(String runId, String expectedPriorId, String actualHeadId) {
        super(ErrorCode.LEDGER_CONFLICT, runId,
              "expected head " + expectedPriorId + " but found " + actualHeadId);
        this.expectedPriorId = expectedPriorId;
        this.actualHeadId = actualHeadId;
    }

    public String getExpectedPriorId() {
        return expectedPriorId;
    }

    public String getActualHeadId() {
        return actualHeadId;
    }
}
