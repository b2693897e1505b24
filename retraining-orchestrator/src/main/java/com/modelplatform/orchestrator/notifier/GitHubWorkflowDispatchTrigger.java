package com.modelplatform.orchestrator.notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * {@link DeploymentTrigger} that starts the CD workflow through GitHub's
 * {@code workflow_dispatch} API.
 *
 * <pre>
 * POST /repos/{owner}/{repo}/actions/workflows/{workflow}/dispatches
 * { "ref": "main",
 *   "inputs": { "model_identifier": ..., "metric_value": ..., "promotion_id": ..., "artifact_ref": ... } }
 * </pre>
 *
 * <p>GitHub answers {@code 204 No Content} on acceptance. Workflow inputs are strings,
 * so every value is sent as text.
 */
@Component
public class GitHubWorkflowDispatchTrigger implements DeploymentTrigger {

    private static final Logger log = LoggerFactory.getLogger(GitHubWorkflowDispatchTrigger.class);

    private final WebClient deploymentTriggerClient;
    private final GitHubDispatchSettings settings;

    public GitHubWorkflowDispatchTrigger(WebClient deploymentTriggerClient, GitHubDispatchSettings settings) {
        this.deploymentTriggerClient = deploymentTriggerClient;
        this.settings                = settings;
    }

    @Override
    public boolean isConfigured() {
        return settings.isComplete();
    }

    @Override
    public Mono<Integer> dispatch(DeploymentRequest request) {
        Map<String, Object> body = Map.of(
            "ref", settings.ref(),
            "inputs", Map.of(
                "model_identifier", request.modelIdentifier(),
                "metric_value",     String.valueOf(request.metricValue()),
                "promotion_id",     request.promotionId(),
                "artifact_ref",     String.valueOf(request.artifactRef())));

        return deploymentTriggerClient.post()
            .uri("/repos/{owner}/{repo}/actions/workflows/{workflow}/dispatches",
                 settings.owner(), settings.repo(), settings.workflow())
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.token())
            .header(HttpHeaders.ACCEPT, "application/vnd.github+json")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .map(response -> response.getStatusCode().value())
            .doOnNext(status -> log.debug("Workflow dispatch accepted. promotionId={} status={}",
                                          request.promotionId(), status))
            .onErrorMap(WebClientResponseException.class,
                        e -> new DeploymentTriggerException(e.getStatusCode().value(),
                                                            "workflow dispatch refused", e))
            .onErrorMap(WebClientRequestException.class,
                        e -> new DeploymentTriggerException(null, "workflow dispatch not delivered", e));
    }
}
