package com.modelplatform.orchestrator.notifier;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface NotificationAttemptRepository extends ReactiveCrudRepository<NotificationAttemptEntity, Long> {

    @Query("""
        SELECT * FROM notification_attempts
        WHERE promotion_id = :promotionId
        ORDER BY attempt_number ASC, id ASC
        """)
    Flux<NotificationAttemptEntity> findByPromotionIdInOrder(String promotionId);

    Mono<Long> countByPromotionId(String promotionId);

    Mono<Boolean> existsByPromotionIdAndOutcome(String promotionId, String outcome);
}
