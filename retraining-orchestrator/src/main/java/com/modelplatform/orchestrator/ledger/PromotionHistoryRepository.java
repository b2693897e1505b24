package com.modelplatform.orchestrator.ledger;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface PromotionHistoryRepository extends ReactiveCrudRepository<PromotionHistory, Long> {

    @Query("SELECT * FROM promotion_history ORDER BY version DESC")
    Flux<PromotionHistory> findAllNewestFirst();

    Mono<PromotionHistory> findByPromotionId(String promotionId);
}
