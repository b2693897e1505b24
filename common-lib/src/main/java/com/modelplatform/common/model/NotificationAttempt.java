package com.modelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One row of the append-only deployment-notification audit trail.
 *
 * <p>{@code attemptNumber} is 1-based for real calls and 0 for the synthetic
 * results the notifier returns without calling out (disabled, misconfigured, ...).
 * {@code httpStatus} is {@code null} when no response was received.
 */
public record NotificationAttempt(
    @JsonProperty("promotionId")   String promotionId,
    @JsonProperty("attemptNumber") int attemptNumber,
    @JsonProperty("sentAt")        Instant sentAt,
    @JsonProperty("outcome")       NotificationOutcome outcome,
    @JsonProperty("httpStatus")    Integer httpStatus
) {
    public static NotificationAttempt skipped(String promotionId, NotificationOutcome outcome) {
        return new NotificationAttempt(promotionId, 0, Instant.now(), outcome, null);
    }
}
