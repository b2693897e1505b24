package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

/**
 * All deployment-notification attempts for a promotion failed. Logged only;
 * the promotion stands.
 */
public class NotificationExhaustedException extends RetrainingException {
    private final String promotionId;
    private final int attempts;

    public NotificationExhaustedException(String runId, String promotionId, int attempts) {
        super(ErrorCode.NOTIFICATION_EXHAUSTED, runId,
              "deployment trigger failed " + attempts + " time(s) for promotion " + promotionId);
        this.promotionId = promotionId;
        this.attempts = attempts;
    }

    public String getPromotionId() {
        return promotionId;
    }

    public int getAttempts() {
        return attempts;
    }
}
