package com.modelplatform.orchestrator.trainer;

import com.modelplatform.common.exception.TrainingFailureException;
import com.modelplatform.common.model.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * {@link CandidateTrainer} that runs a synchronous training job on the training service.
 * The response carries the artifact URI and the held-out metric the evaluator compares.
 */
@Component
public class HttpCandidateTrainer implements CandidateTrainer {

    private static final Logger log = LoggerFactory.getLogger(HttpCandidateTrainer.class);

    private final WebClient trainerClient;

    public HttpCandidateTrainer(WebClient trainerClient) {
        this.trainerClient = trainerClient;
    }

    @Override
    public Mono<Candidate> train(String runId, String datasetRef) {
        return trainerClient.post()
            .uri("/api/v1/training/jobs")
            .header("X-Run-Id", runId)
            .bodyValue(Map.of("runId", runId, "datasetRef", datasetRef))
            .retrieve()
            .bodyToMono(TrainingJobResponse.class)
            .switchIfEmpty(Mono.error(() -> new TrainingFailureException(runId, "trainer returned no body")))
            .flatMap(response -> toCandidate(runId, response))
            .doOnNext(c -> log.debug("Training job finished. runId={} artifactRef={} metric={}",
                                    runId, c.artifactRef(), c.metricValue()))
            .doOnCancel(() -> log.warn("Training call abandoned. runId={}", runId))
            .onErrorMap(e -> !(e instanceof TrainingFailureException),
                        e -> new TrainingFailureException(runId, "trainer call failed", e));
    }

    private static Mono<Candidate> toCandidate(String runId, TrainingJobResponse response) {
        if (response.artifactRef() == null || response.artifactRef().isBlank()) {
            return Mono.error(new TrainingFailureException(runId, "trainer response has no artifactRef"));
        }
        if (response.metricValue() == null) {
            return Mono.error(new TrainingFailureException(runId, "trainer response has no metricValue"));
        }
        Instant trainedAt = response.trainedAt() != null ? response.trainedAt() : Instant.now();
        return Mono.just(new Candidate(runId, response.artifactRef(), response.metricValue(),
                                       trainedAt, response.metrics()));
    }
}
