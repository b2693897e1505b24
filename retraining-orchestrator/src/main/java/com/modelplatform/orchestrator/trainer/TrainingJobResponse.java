package com.modelplatform.orchestrator.trainer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Body returned by the training service once a job finishes.
 */
public record TrainingJobResponse(
    @JsonProperty("artifactRef") String artifactRef,
    @JsonProperty("metricValue") Double metricValue,
    @JsonProperty("trainedAt")   Instant trainedAt,
    @JsonProperty("metrics")     Map<String, Double> metrics
) {}
