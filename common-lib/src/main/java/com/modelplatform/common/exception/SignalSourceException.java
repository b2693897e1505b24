package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

public class SignalSourceException extends RetrainingException {

    public SignalSourceException(String runId, String message, Throwable cause) {
        super(ErrorCode.SIGNAL_SOURCE_FAILURE, runId, message, cause);
    }
}
