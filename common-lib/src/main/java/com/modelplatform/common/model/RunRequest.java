package com.modelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * A request to execute one retraining decision cycle.
 *
 * <p>{@code runId} is the idempotency key: resubmitting a request whose run already
 * reached a terminal outcome returns that outcome instead of running again.
 * {@code datasetRef} may be {@code null}, in which case the orchestrator uses its
 * configured default dataset.
 */
public record RunRequest(
    @JsonProperty("runId")        String runId,
    @JsonProperty("requestedAt")  Instant requestedAt,
    @JsonProperty("forceRetrain") boolean forceRetrain,
    @JsonProperty("datasetRef")   String datasetRef
) {
    /** Longest run id the orchestrator stores. */
    public static final int MAX_RUN_ID_LENGTH = 255;

    /** Creates a request with a fresh random run id, as the scheduler does. */
    public static RunRequest scheduled(String datasetRef, boolean forceRetrain) {
        return new RunRequest(UUID.randomUUID().toString(), Instant.now(), forceRetrain, datasetRef);
    }

    /**
     * Fills in the fields a remote caller may omit. Returns {@code this} when
     * nothing is missing.
     */
    public RunRequest withDefaults(String defaultDatasetRef) {
        boolean missingId      = runId == null || runId.isBlank();
        boolean missingTime    = requestedAt == null;
        boolean missingDataset = datasetRef == null || datasetRef.isBlank();
        if (!missingId && !missingTime && !missingDataset) {
            return this;
        }
        return new RunRequest(
            missingId      ? UUID.randomUUID().toString() : runId,
            missingTime    ? Instant.now()                : requestedAt,
            forceRetrain,
            missingDataset ? defaultDatasetRef            : datasetRef);
    }
}
