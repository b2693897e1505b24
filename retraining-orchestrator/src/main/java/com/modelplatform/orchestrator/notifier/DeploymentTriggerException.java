package com.modelplatform.orchestrator.notifier;

/**
 * A deployment trigger call that reached the remote side and was refused, or failed in
 * transport ({@code httpStatus} null).
 */
public class DeploymentTriggerException extends RuntimeException {
    private final Integer httpStatus;

    public DeploymentTriggerException(Integer httpStatus, String message) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public DeploymentTriggerException(Integer httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
