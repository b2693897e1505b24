package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

public class ConcurrentRunRejectedException extends RetrainingException {
    private final String holderRunId;

    public ConcurrentRunRejectedException(String runId, String holderRunId) {
        super(ErrorCode.CONCURRENT_RUN_REJECTED, runId, "run " + holderRunId + " holds the pipeline lock");
        this.holderRunId = holderRunId;
    }

    public String getHolderRunId() {
        return holderRunId;
    }
}
