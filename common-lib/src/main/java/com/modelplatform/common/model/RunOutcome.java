package com.modelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Terminal record of one run. Immutable once written.
 *
 * <p>{@code promotionId} is set only for {@link RunDecision#PROMOTED};
 * {@code candidateMetric} is set whenever a candidate was trained.
 */
public record RunOutcome(
    @JsonProperty("runId")           String runId,
    @JsonProperty("decision")        RunDecision decision,
    @JsonProperty("error")           RunError error,
    @JsonProperty("completedAt")     Instant completedAt,
    @JsonProperty("promotionId")     String promotionId,
    @JsonProperty("candidateMetric") Double candidateMetric
) {
    public static RunOutcome skipped(String runId) {
        return new RunOutcome(runId, RunDecision.SKIPPED, null, Instant.now(), null, null);
    }

    public static RunOutcome notPromoted(String runId, double candidateMetric) {
        return new RunOutcome(runId, RunDecision.TRAINED_NOT_PROMOTED, null, Instant.now(), null, candidateMetric);
    }

    public static RunOutcome promoted(String runId, PromotionRecord record) {
        return new RunOutcome(runId, RunDecision.PROMOTED, null, Instant.now(),
                              record.promotionId(), record.metricValue());
    }

    public static RunOutcome failed(String runId, RunError error, Double candidateMetric) {
        return new RunOutcome(runId, RunDecision.FAILED, error, Instant.now(), null, candidateMetric);
    }

    public static RunOutcome rejected(String runId, String holderRunId) {
        return new RunOutcome(runId, RunDecision.REJECTED,
            new RunError(ErrorCode.CONCURRENT_RUN_REJECTED, "Another run is active: " + holderRunId),
            Instant.now(), null, null);
    }
}
