package com.modelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The model of record at a point in the promotion history.
 *
 * <p>{@code promotionId} is the correlation token sent with every deployment trigger
 * call for this promotion. {@link #NONE} is the ledger head before the first
 * promotion; it has no metric and no artifact.
 */
public record PromotionRecord(
    @JsonProperty("promotionId")       String promotionId,
    @JsonProperty("modelIdentifier")   String modelIdentifier,
    @JsonProperty("version")           long version,
    @JsonProperty("artifactRef")       String artifactRef,
    @JsonProperty("metricValue")       Double metricValue,
    @JsonProperty("promotedAt")        Instant promotedAt,
    @JsonProperty("promotedFromRunId") String promotedFromRunId
) {
    public static final String NONE_IDENTIFIER = "none";

    public static final PromotionRecord NONE =
        new PromotionRecord(null, NONE_IDENTIFIER, 0L, null, null, null, null);

    @JsonIgnore
    public boolean isNone() {
        return NONE_IDENTIFIER.equals(modelIdentifier);
    }
}
