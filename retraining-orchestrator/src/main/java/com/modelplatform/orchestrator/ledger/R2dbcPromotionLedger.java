package com.modelplatform.orchestrator.ledger;

import com.modelplatform.common.exception.LedgerStorageException;
import com.modelplatform.common.model.Candidate;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.orchestrator.config.OrchestratorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * {@link PromotionLedger} backed by the model registry tables
 * ({@code model_ledger_head}, {@code promotion_history}).
 *
 * <p>A commit is one R2DBC transaction: read the head to derive the next version,
 * conditionally update the head against {@code expectedPriorId}, and insert the history
 * row only when the update matched. A cancelled or failed commit rolls back, so a
 * partial promotion is never visible.
 */
@Component
public class R2dbcPromotionLedger implements PromotionLedger {

    private static final Logger log = LoggerFactory.getLogger(R2dbcPromotionLedger.class);

    static final String CURRENT_SLOT = "current";

    private final LedgerHeadRepository headRepository;
    private final PromotionHistoryRepository historyRepository;
    private final TransactionalOperator transactionalOperator;
    private final String registryName;

    public R2dbcPromotionLedger(LedgerHeadRepository headRepository,
                                PromotionHistoryRepository historyRepository,
                                ReactiveTransactionManager transactionManager,
                                OrchestratorSettings settings) {
        this.headRepository        = headRepository;
        this.historyRepository     = historyRepository;
        this.transactionalOperator = TransactionalOperator.create(transactionManager);
        this.registryName          = settings.registryName();
    }

    @Override
    public Mono<PromotionRecord> readCurrent() {
        return headRepository.findBySlot(CURRENT_SLOT)
            .map(LedgerHead::toRecord)
            .defaultIfEmpty(PromotionRecord.NONE)
            .onErrorMap(e -> new LedgerStorageException(null, "ledger head read failed", e));
    }

    @Override
    public Mono<CommitResult> tryCommit(Candidate candidate, String expectedPriorId) {
        Mono<CommitResult> commit = headRepository.findBySlot(CURRENT_SLOT)
            .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                "ledger head row '" + CURRENT_SLOT + "' is missing; was schema.sql applied?")))
            .flatMap(head -> {
                PromotionRecord proposed = nextRecord(candidate, head);
                LocalDateTime promotedAt = LocalDateTime.ofInstant(proposed.promotedAt(), ZoneOffset.UTC);
                return headRepository.compareAndSet(CURRENT_SLOT, expectedPriorId,
                        proposed.promotionId(), proposed.modelIdentifier(), proposed.version(),
                        proposed.artifactRef(), proposed.metricValue(),
                        promotedAt, proposed.promotedFromRunId())
                    .flatMap(updated -> {
                        if (updated == 0) {
                            log.warn("Ledger compare-and-swap lost. runId={} expectedPriorId={} actualHeadId={}",
                                     candidate.runId(), expectedPriorId, head.getModelIdentifier());
                            return Mono.just((CommitResult) new CommitResult.Conflict(
                                expectedPriorId, head.getModelIdentifier()));
                        }
                        return historyRepository.save(PromotionHistory.from(proposed))
                            .thenReturn((CommitResult) new CommitResult.Committed(proposed));
                    });
            });

        return transactionalOperator.transactional(commit)
            .doOnNext(result -> {
                if (result instanceof CommitResult.Committed committed) {
                    log.info("Ledger head moved. runId={} modelIdentifier={} version={} metric={}",
                             candidate.runId(), committed.record().modelIdentifier(),
                             committed.record().version(), committed.record().metricValue());
                }
            })
            .onErrorMap(e -> !(e instanceof LedgerStorageException),
                        e -> new LedgerStorageException(candidate.runId(), "ledger commit failed", e));
    }

    @Override
    public Flux<PromotionRecord> history() {
        return historyRepository.findAllNewestFirst()
            .map(PromotionHistory::toRecord)
            .onErrorMap(e -> new LedgerStorageException(null, "promotion history read failed", e));
    }

    @Override
    public Mono<Long> historySize() {
        return historyRepository.count()
            .onErrorMap(e -> new LedgerStorageException(null, "promotion history count failed", e));
    }

    private PromotionRecord nextRecord(Candidate candidate, LedgerHead head) {
        long version = (head.getVersion() != null ? head.getVersion() : 0L) + 1;
        return new PromotionRecord(
            UUID.randomUUID().toString(),
            registryName + "-v" + version,
            version,
            candidate.artifactRef(),
            candidate.metricValue(),
            Instant.now().truncatedTo(ChronoUnit.MILLIS),
            candidate.runId());
    }
}
