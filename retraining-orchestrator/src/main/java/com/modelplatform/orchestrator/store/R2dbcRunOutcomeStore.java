package com.modelplatform.orchestrator.store;

import com.modelplatform.common.model.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class R2dbcRunOutcomeStore implements RunOutcomeStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcRunOutcomeStore.class);

    private final RunOutcomeRepository repository;

    public R2dbcRunOutcomeStore(RunOutcomeRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<RunOutcome> save(RunOutcome outcome) {
        return repository.save(RunOutcomeEntity.from(outcome))
            .map(RunOutcomeEntity::toOutcome)
            .doOnNext(saved -> log.debug("Run outcome recorded. runId={} decision={}",
                                         saved.runId(), saved.decision()));
    }

    @Override
    public Mono<RunOutcome> find(String runId) {
        return repository.findByRunId(runId).map(RunOutcomeEntity::toOutcome);
    }
}
