package com.modelplatform.orchestrator.notifier;

import com.modelplatform.common.model.NotificationAttempt;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only audit trail of deployment-notification calls. Each attempt is a new row;
 * rows are never updated, so concurrent retries for one promotion need no extra locking.
 */
public interface NotificationAttemptLog {

    Mono<NotificationAttempt> append(NotificationAttempt attempt);

    /** Attempts for a promotion in attempt order. */
    Flux<NotificationAttempt> findByPromotionId(String promotionId);

    Mono<Boolean> hasSuccess(String promotionId);

    Mono<Long> countByPromotionId(String promotionId);
}
