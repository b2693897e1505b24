package com.modelplatform.orchestrator.controller;

import com.modelplatform.common.model.ErrorCode;
import com.modelplatform.common.model.RunDecision;
import com.modelplatform.common.model.RunOutcome;

import java.time.Instant;

/**
 * Wire form of a {@link RunOutcome}. Carries the sanitised error message only.
 */
public record RunOutcomeResponse(
    String runId,
    RunDecision decision,
    ErrorCode errorCode,
    String message,
    Instant completedAt,
    String promotionId
) {
    public static RunOutcomeResponse from(RunOutcome outcome) {
        return new RunOutcomeResponse(
            outcome.runId(),
            outcome.decision(),
            outcome.error() != null ? outcome.error().code() : null,
            outcome.error() != null ? outcome.error().message() : null,
            outcome.completedAt(),
            outcome.promotionId());
    }
}
