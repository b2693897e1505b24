package com.modelplatform.common.model;

/**
 * Result of one deployment-notification call, or of a call that was not made.
 *
 * <p>Only {@link #SUCCESS}, {@link #FAILURE} and {@link #TIMEOUT} correspond to an
 * outbound call and are written to the attempt log.
 */
public enum NotificationOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT,
    DISABLED,
    MISCONFIGURED,
    ALREADY_DELIVERED,
    IN_FLIGHT;

    public boolean isAttempt() {
        return this == SUCCESS || this == FAILURE || this == TIMEOUT;
    }
}
