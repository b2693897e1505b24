package com.modelplatform.orchestrator.logger;

import com.modelplatform.common.model.Candidate;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.common.model.RunOutcome;
import com.modelplatform.common.model.RunState;
import com.modelplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for the retraining lifecycle. Logs each state transition and the
 * terminal outcome without touching run behaviour; all methods are pure side-effects.
 *
 * <p>Every line carries {@code runId} both in the message and, for the duration of the
 * call, in MDC.
 */
@Component
public class RetrainingFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RetrainingFlowLogger.class);

    /**
     * {@code doOnEach} hook that logs {@code stageName} on {@code onNext}, reading the run id
     * from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = TraceContextUtil.getRunId(signal.getContextView());
            TraceContextUtil.withMdc(runId, () ->
                log.info("[RetrainingFlow] stage={} runId={}", stageName, runId)
            );
        };
    }

    public void transition(String runId, RunState from, RunState to) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[RetrainingFlow] stage={} from={} runId={}", to, from, runId)
        );
    }

    public void candidateEvaluated(String runId, Candidate candidate, PromotionRecord current,
                                   boolean accepted, String reason) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[RetrainingFlow] evaluation accepted={} candidateMetric={} currentModel={} "
                     + "currentMetric={} reason=\"{}\" runId={}",
                     accepted, candidate.metricValue(), current.modelIdentifier(),
                     current.metricValue(), reason, runId)
        );
    }

    public void outcome(RunOutcome outcome, long elapsedMs) {
        TraceContextUtil.withMdc(outcome.runId(), () ->
            log.info("[RetrainingFlow] outcome decision={} errorCode={} promotionId={} elapsedMs={} runId={}",
                     outcome.decision(),
                     outcome.error() != null ? outcome.error().code() : "none",
                     outcome.promotionId(), elapsedMs, outcome.runId())
        );
    }
}
