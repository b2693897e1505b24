package com.modelplatform.orchestrator.store;

import com.modelplatform.common.model.RunOutcome;
import reactor.core.publisher.Mono;

/**
 * Durable terminal records of runs, keyed by run id. A run id is written at most once.
 */
public interface RunOutcomeStore {

    Mono<RunOutcome> save(RunOutcome outcome);

    /** Empty when the run never reached a recorded terminal state. */
    Mono<RunOutcome> find(String runId);
}
