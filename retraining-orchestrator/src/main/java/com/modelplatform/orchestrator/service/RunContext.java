package com.modelplatform.orchestrator.service;

import com.modelplatform.common.model.Candidate;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.common.model.RunRequest;
import com.modelplatform.common.model.RunState;
import com.modelplatform.orchestrator.guard.CancellationToken;
import com.modelplatform.orchestrator.logger.RetrainingFlowLogger;

import java.time.Instant;

/**
 * Mutable per-run state owned by {@link RetrainingOrchestrator} between lock acquisition
 * and release. Stages run sequentially, but cancellation and {@code activeRun()} read the
 * state from other threads, so every access is synchronized.
 */
final class RunContext {

    private final RunRequest request;
    private final CancellationToken token;
    private final RetrainingFlowLogger flowLogger;
    private final Instant startedAt = Instant.now();

    private RunState state = RunState.IDLE;
    private Candidate candidate;
    private PromotionRecord committed;

    RunContext(RunRequest request, CancellationToken token, RetrainingFlowLogger flowLogger) {
        this.request    = request;
        this.token      = token;
        this.flowLogger = flowLogger;
    }

    /**
     * @throws IllegalStateException if {@code next} is not a successor of the current state
     */
    synchronized void transition(RunState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                "illegal run transition " + state + " -> " + next + " runId=" + request.runId());
        }
        RunState previous = state;
        state = next;
        flowLogger.transition(request.runId(), previous, next);
    }

    /** Moves to {@code FAILED} unless the run already ended. */
    synchronized boolean failIfActive() {
        if (state.isTerminal()) {
            return false;
        }
        transition(RunState.FAILED);
        return true;
    }

    synchronized RunState state() {
        return state;
    }

    synchronized Candidate candidate() {
        return candidate;
    }

    synchronized void candidate(Candidate trained) {
        this.candidate = trained;
    }

    synchronized PromotionRecord committed() {
        return committed;
    }

    synchronized void committed(PromotionRecord record) {
        this.committed = record;
    }

    synchronized Double candidateMetric() {
        return candidate != null ? candidate.metricValue() : null;
    }

    ActiveRun snapshot() {
        return new ActiveRun(request.runId(), state(), startedAt, request.forceRetrain());
    }

    String runId() {
        return request.runId();
    }

    String datasetRef() {
        return request.datasetRef();
    }

    boolean forceRetrain() {
        return request.forceRetrain();
    }

    CancellationToken token() {
        return token;
    }
}
