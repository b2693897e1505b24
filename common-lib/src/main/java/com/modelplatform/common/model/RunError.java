package com.modelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sanitised error attached to a failed {@link RunOutcome}.
 * {@code message} is composed by the orchestrator and never echoes exception text.
 */
public record RunError(
    @JsonProperty("code")    ErrorCode code,
    @JsonProperty("message") String message
) {}
