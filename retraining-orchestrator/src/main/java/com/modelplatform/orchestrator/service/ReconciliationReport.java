package com.modelplatform.orchestrator.service;

import com.modelplatform.common.model.NotificationOutcome;

/**
 * What {@link ReconciliationService} found and repaired at startup.
 *
 * @param headModelIdentifier  ledger head at the time of the check, {@code "none"} before the first promotion
 * @param promotionId          promotion the checks were run against, {@code null} when there is none
 * @param outcomeInferred      a missing {@code PROMOTED} outcome was written for the promoting run
 * @param notificationOutcome  result of a re-sent notification, {@code null} when none was needed
 * @param skippedReason        why no check ran, {@code null} when checks ran
 */
public record ReconciliationReport(
    String headModelIdentifier,
    String promotionId,
    boolean outcomeInferred,
    NotificationOutcome notificationOutcome,
    String skippedReason
) {
    static ReconciliationReport skipped(String headModelIdentifier, String reason) {
        return new ReconciliationReport(headModelIdentifier, null, false, null, reason);
    }

    public boolean notificationResent() {
        return notificationOutcome != null;
    }
}
