package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

/**
 * Root of the retraining pipeline's exception hierarchy. Each subclass pins the
 * {@link ErrorCode} a failed run reports.
 */
public class RetrainingException extends RuntimeException {
    private final ErrorCode code;
    private final String runId;

    public RetrainingException(ErrorCode code, String runId, String message) {
        super("[" + code + "] " + message);
        this.code = code;
        this.runId = runId;
    }

    public RetrainingException(ErrorCode code, String runId, String message, Throwable cause) {
        super("[" + code + "] " + message, cause);
        this.code = code;
        this.runId = runId;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getRunId() {
        return runId;
    }
}
