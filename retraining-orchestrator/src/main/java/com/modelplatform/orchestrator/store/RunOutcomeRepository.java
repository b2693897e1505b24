package com.modelplatform.orchestrator.store;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface RunOutcomeRepository extends ReactiveCrudRepository<RunOutcomeEntity, Long> {

    Mono<RunOutcomeEntity> findByRunId(String runId);
}
