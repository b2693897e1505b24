package com.modelplatform.orchestrator.support;

import com.modelplatform.common.model.RunOutcome;
import com.modelplatform.orchestrator.store.RunOutcomeStore;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRunOutcomeStore implements RunOutcomeStore {

    private final Map<String, RunOutcome> outcomes = new ConcurrentHashMap<>();

    public Map<String, RunOutcome> outcomes() {
        return Map.copyOf(outcomes);
    }

    @Override
    public Mono<RunOutcome> save(RunOutcome outcome) {
        return Mono.fromCallable(() -> {
            if (outcomes.putIfAbsent(outcome.runId(), outcome) != null) {
                throw new IllegalStateException("duplicate outcome for run " + outcome.runId());
            }
            return outcome;
        });
    }

    @Override
    public Mono<RunOutcome> find(String runId) {
        return Mono.justOrEmpty(outcomes.get(runId));
    }
}
