package com.modelplatform.orchestrator.trainer;

import com.modelplatform.common.model.Candidate;
import reactor.core.publisher.Mono;

/**
 * Black-box training collaborator. Training may take long; cancelling the subscription
 * must abandon the job. Failures are signalled as {@code TrainingFailureException}.
 */
@FunctionalInterface
public interface CandidateTrainer {

    Mono<Candidate> train(String runId, String datasetRef);
}
