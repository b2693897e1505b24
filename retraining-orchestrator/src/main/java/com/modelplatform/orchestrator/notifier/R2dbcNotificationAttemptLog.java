package com.modelplatform.orchestrator.notifier;

import com.modelplatform.common.model.NotificationAttempt;
import com.modelplatform.common.model.NotificationOutcome;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Component
public class R2dbcNotificationAttemptLog implements NotificationAttemptLog {

    private final NotificationAttemptRepository repository;

    public R2dbcNotificationAttemptLog(NotificationAttemptRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<NotificationAttempt> append(NotificationAttempt attempt) {
        if (!attempt.outcome().isAttempt()) {
            return Mono.error(new IllegalArgumentException(
                "only outbound calls are logged, got outcome " + attempt.outcome()));
        }
        return repository.save(NotificationAttemptEntity.from(attempt))
            .map(NotificationAttemptEntity::toAttempt);
    }

    @Override
    public Flux<NotificationAttempt> findByPromotionId(String promotionId) {
        return repository.findByPromotionIdInOrder(promotionId).map(NotificationAttemptEntity::toAttempt);
    }

    @Override
    public Mono<Boolean> hasSuccess(String promotionId) {
        return repository.existsByPromotionIdAndOutcome(promotionId, NotificationOutcome.SUCCESS.name());
    }

    @Override
    public Mono<Long> countByPromotionId(String promotionId) {
        return repository.countByPromotionId(promotionId);
    }
}
