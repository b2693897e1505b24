package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

public class RunCancelledException extends RetrainingException {

    public RunCancelledException(String runId) {
        super(ErrorCode.CANCELLED, runId, "run cancelled");
    }
}
