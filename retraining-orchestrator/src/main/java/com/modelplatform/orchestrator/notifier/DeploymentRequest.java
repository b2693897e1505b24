package com.modelplatform.orchestrator.notifier;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.modelplatform.common.model.PromotionRecord;

/**
 * Payload sent to the deployment trigger. {@code promotionId} is the correlation token
 * the receiving side deduplicates on.
 */
public record DeploymentRequest(
    @JsonProperty("model_identifier") String modelIdentifier,
    @JsonProperty("metric_value")     double metricValue,
    @JsonProperty("promotion_id")     String promotionId,
    @JsonProperty("artifact_ref")     String artifactRef
) {
    public static DeploymentRequest from(PromotionRecord record) {
        return new DeploymentRequest(record.modelIdentifier(),
                                     record.metricValue() != null ? record.metricValue() : 0.0,
                                     record.promotionId(), record.artifactRef());
    }
}
