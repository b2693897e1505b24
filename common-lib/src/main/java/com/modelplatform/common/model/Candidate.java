package com.modelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * A newly trained, scored model artifact that has not been promoted.
 *
 * <p>{@code metricValue} is the single score the evaluator compares; {@code metrics}
 * carries any additional scores the trainer reported (f1, precision, ...) and is
 * never consulted for promotion.
 */
public record Candidate(
    @JsonProperty("runId")       String runId,
    @JsonProperty("artifactRef") String artifactRef,
    @JsonProperty("metricValue") double metricValue,
    @JsonProperty("trainedAt")   Instant trainedAt,
    @JsonProperty("metrics")     Map<String, Double> metrics
) {
    public Candidate {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static Candidate of(String runId, String artifactRef, double metricValue, Instant trainedAt) {
        return new Candidate(runId, artifactRef, metricValue, trainedAt, Map.of());
    }
}
