package com.modelplatform.scheduler.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.modelplatform.common.model.ErrorCode;
import com.modelplatform.common.model.RunDecision;

/**
 * The part of the orchestrator's run response the scheduler acts on.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunSubmission(String runId, RunDecision decision, ErrorCode errorCode, String message) {

    static RunSubmission rejected(String runId) {
        return new RunSubmission(runId, RunDecision.REJECTED, ErrorCode.CONCURRENT_RUN_REJECTED, null);
    }
}
