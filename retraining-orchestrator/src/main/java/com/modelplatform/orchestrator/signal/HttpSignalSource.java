package com.modelplatform.orchestrator.signal;

import com.modelplatform.common.exception.SignalSourceException;
import com.modelplatform.common.model.DriftVerdict;
import com.modelplatform.common.model.QualityVerdict;
import com.modelplatform.orchestrator.config.OrchestratorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link SignalSource} backed by the monitoring service, which runs the data-quality
 * suite and the drift/performance report.
 *
 * <p>Unlike the lenient adapters elsewhere, nothing here falls back to a default: a
 * missing verdict must stop the run rather than let it train on unchecked data.
 */
@Component
public class HttpSignalSource implements SignalSource {

    private static final Logger log = LoggerFactory.getLogger(HttpSignalSource.class);

    private final WebClient monitoringClient;
    private final OrchestratorSettings settings;

    public HttpSignalSource(WebClient monitoringClient, OrchestratorSettings settings) {
        this.monitoringClient = monitoringClient;
        this.settings         = settings;
    }

    @Override
    public Mono<QualityVerdict> getQualityVerdict(String runId, String datasetRef) {
        return monitoringClient.post()
            .uri("/api/v1/quality/validate")
            .header("X-Run-Id", runId)
            .bodyValue(Map.of("datasetRef", datasetRef))
            .retrieve()
            .bodyToMono(QualityVerdict.class)
            .timeout(settings.signalTimeout())
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("empty quality verdict")))
            .doOnNext(v -> log.debug("Quality verdict received. runId={} passed={} failed={}",
                                     runId, v.passed(), v.failedExpectations().size()))
            .onErrorMap(e -> !(e instanceof SignalSourceException),
                        e -> new SignalSourceException(runId, "quality verdict unavailable", e));
    }

    @Override
    public Mono<DriftVerdict> getDriftVerdict(String runId, String datasetRef, String currentModelRef) {
        Map<String, Object> body = new HashMap<>();
        body.put("datasetRef", datasetRef);
        body.put("currentModelRef", currentModelRef);

        return monitoringClient.post()
            .uri("/api/v1/drift/analyze")
            .header("X-Run-Id", runId)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(DriftVerdict.class)
            .timeout(settings.signalTimeout())
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("empty drift verdict")))
            .doOnNext(v -> log.debug("Drift verdict received. runId={} drift={} degraded={} report={}",
                                     runId, v.driftDetected(), v.performanceDegraded(), v.summaryRef()))
            .onErrorMap(e -> !(e instanceof SignalSourceException),
                        e -> new SignalSourceException(runId, "drift verdict unavailable", e));
    }
}
