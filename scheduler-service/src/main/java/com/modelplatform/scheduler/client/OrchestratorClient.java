package com.modelplatform.scheduler.client;

import com.modelplatform.common.model.RunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Submits scheduled {@link RunRequest}s to the retraining orchestrator.
 *
 * <p>The call returns when the run reaches a terminal state, which can take as long as
 * training does. A 409 answer is the orchestrator's busy signal and is returned as a
 * {@code REJECTED} submission. Every other failure is signalled to the caller.
 */
@Component
public class OrchestratorClient {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorClient.class);

    private final WebClient orchestratorClient;

    public OrchestratorClient(WebClient orchestratorClient) {
        this.orchestratorClient = orchestratorClient;
    }

    public Mono<RunSubmission> submit(RunRequest request) {
        return orchestratorClient.post()
            .uri("/api/v1/retraining/runs")
            .header("X-Run-Id", request.runId())
            .bodyValue(request)
            .retrieve()
            .bodyToMono(RunSubmission.class)
            .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                "orchestrator returned no body for run " + request.runId())))
            .onErrorResume(WebClientResponseException.class, e -> {
                if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                    log.info("Orchestrator busy. runId={}", request.runId());
                    return Mono.just(RunSubmission.rejected(request.runId()));
                }
                return Mono.error(e);
            });
    }
}
