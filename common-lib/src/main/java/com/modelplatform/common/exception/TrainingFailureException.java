package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

public class TrainingFailureException extends RetrainingException {

    public TrainingFailureException(String runId, String message) {
        super(ErrorCode.TRAINING_FAILURE, runId, message);
    }

    public TrainingFailureException(String runId, String message, Throwable cause) {
        super(ErrorCode.TRAINING_FAILURE, runId, message, cause);
    }
}
