package com.modelplatform.orchestrator.ledger;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface LedgerHeadRepository extends ReactiveCrudRepository<LedgerHead, String> {

    @Query("SELECT * FROM model_ledger_head WHERE slot = :slot")
    Mono<LedgerHead> findBySlot(String slot);

    /**
     * Conditional write: moves the head only while it still carries
     * {@code expectedPriorId}. Returns the number of rows changed, 0 on conflict.
     */
    @Modifying
    @Query("""
        UPDATE model_ledger_head SET
            promotion_id         = :promotionId,
            model_identifier     = :modelIdentifier,
            version              = :version,
            artifact_ref         = :artifactRef,
            metric_value         = :metricValue,
            promoted_at          = :promotedAt,
            promoted_from_run_id = :promotedFromRunId
        WHERE slot = :slot
          AND model_identifier = :expectedPriorId
        """)
    Mono<Integer> compareAndSet(String slot, String expectedPriorId,
                                String promotionId, String modelIdentifier, long version,
                                String artifactRef, double metricValue,
                                LocalDateTime promotedAt, String promotedFromRunId);
}
