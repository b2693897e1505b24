package com.modelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Drift and performance judgment for the currently serving model.
 *
 * <p>{@code currentMetric} and {@code referenceMetric} are informational and may be
 * {@code null} when the monitoring service could not compute them. Gating only
 * looks at the two flags.
 */
public record DriftVerdict(
    @JsonProperty("driftDetected")       boolean driftDetected,
    @JsonProperty("performanceDegraded") boolean performanceDegraded,
    @JsonProperty("summaryRef")          String summaryRef,
    @JsonProperty("currentMetric")       Double currentMetric,
    @JsonProperty("referenceMetric")     Double referenceMetric
) {
    public static DriftVerdict stable(String summaryRef) {
        return new DriftVerdict(false, false, summaryRef, null, null);
    }

    @JsonIgnore
    public boolean retrainingNeeded() {
        return driftDetected || performanceDegraded;
    }
}
