package com.modelplatform.orchestrator.ledger;

import com.modelplatform.common.model.PromotionRecord;

/**
 * Result of {@link PromotionLedger#tryCommit}.
 */
public sealed interface CommitResult permits CommitResult.Committed, CommitResult.Conflict {

    record Committed(PromotionRecord record) implements CommitResult {}

    record Conflict(String expectedPriorId, String actualHeadId) implements CommitResult {}
}
