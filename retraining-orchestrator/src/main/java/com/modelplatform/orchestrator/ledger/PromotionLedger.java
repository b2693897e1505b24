package com.modelplatform.orchestrator.ledger;

import com.modelplatform.common.model.Candidate;
import com.modelplatform.common.model.PromotionRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable record of the currently promoted model plus its append-only history.
 *
 * <p>The ledger is the sole writer of {@link PromotionRecord}s, and the only mutation it
 * offers is {@link #tryCommit}: a compare-and-swap against the head identifier the
 * caller observed. This keeps promotion linearizable even if single-flight execution
 * were ever bypassed.
 */
public interface PromotionLedger {

    /**
     * @return the last committed head, or {@link PromotionRecord#NONE} before the first
     *         promotion; never empty
     */
    Mono<PromotionRecord> readCurrent();

    /**
     * Makes {@code candidate} the new head iff the head identifier still equals
     * {@code expectedPriorId}. Either the head and one history row are written
     * together, or nothing is.
     *
     * @return {@link CommitResult.Committed} with the new head, or
     *         {@link CommitResult.Conflict} when the head moved; storage errors are
     *         signalled as {@code LedgerStorageException}
     */
    Mono<CommitResult> tryCommit(Candidate candidate, String expectedPriorId);

    /** Every promotion ever committed, newest first. */
    Flux<PromotionRecord> history();

    Mono<Long> historySize();
}
