package com.modelplatform.scheduler.job;

import com.modelplatform.common.model.RunRequest;
import com.modelplatform.scheduler.client.OrchestratorClient;
import com.modelplatform.scheduler.strategy.RetrainTempoStrategy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodic trigger for the retraining pipeline.
 *
 * <pre>
 *   delay(next) → submit RunRequest → pick next delay from the decision → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the
 * next one; {@code Mono.delay()} releases the thread while waiting. The loop never stops:
 * an unreachable orchestrator only switches it to the fallback interval.
 */
@Component
public class RetrainingScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetrainingScheduler.class);

    private final OrchestratorClient orchestratorClient;
    private final RetrainTempoStrategy tempoStrategy;

    @Value("${scheduler.enabled:true}")
    private boolean enabled;

    @Value("${scheduler.initial-delay:PT1M}")
    private Duration initialDelay;

    @Value("${scheduler.force-retrain:false}")
    private boolean forceRetrain;

    @Value("${scheduler.dataset-ref:}")
    private String datasetRef;

    @Value("${scheduler.request-timeout:PT3H}")
    private Duration requestTimeout;

    private volatile Disposable pending;
    private volatile boolean stopped;

    public RetrainingScheduler(OrchestratorClient orchestratorClient, RetrainTempoStrategy tempoStrategy) {
        this.orchestratorClient = orchestratorClient;
        this.tempoStrategy      = tempoStrategy;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Retraining scheduler disabled");
            return;
        }
        log.info("Retraining scheduler started. initialDelaySeconds={} intervalSeconds={} forceRetrain={}",
                 initialDelay.toSeconds(), tempoStrategy.interval().toSeconds(), forceRetrain);
        scheduleNextCycle(initialDelay);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable current = pending;
        if (current != null) {
            current.dispose();
        }
    }

    private void scheduleNextCycle(Duration delay) {
        if (stopped) {
            return;
        }
        pending = Mono.delay(delay)
            .then(Mono.defer(this::runCycle))
            .subscribe(
                next -> scheduleNextCycle(next),
                err -> {
                    log.error("Scheduling cycle failed, rescheduling with fallback interval", err);
                    scheduleNextCycle(tempoStrategy.unreachable());
                });
    }

    /**
     * Submits one run and resolves the delay before the next. Never errors.
     */
    Mono<Duration> runCycle() {
        RunRequest request = RunRequest.scheduled(datasetRef == null || datasetRef.isBlank() ? null : datasetRef,
                                                  forceRetrain);
        log.info("Submitting scheduled run. runId={} forceRetrain={}", request.runId(), request.forceRetrain());

        return orchestratorClient.submit(request)
            .timeout(requestTimeout)
            .map(submission -> {
                Duration next = tempoStrategy.resolve(submission.decision());
                log.info("RETRAIN_TEMPO_SELECTED runId={} decision={} errorCode={} nextIntervalSeconds={}",
                         request.runId(), submission.decision(), submission.errorCode(), next.toSeconds());
                return next;
            })
            .onErrorResume(e -> {
                Duration next = tempoStrategy.unreachable();
                log.warn("Orchestrator unreachable. runId={} nextIntervalSeconds={} reason={}",
                         request.runId(), next.toSeconds(), e.getMessage());
                return Mono.just(next);
            });
    }
}
