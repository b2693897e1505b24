package com.modelplatform.orchestrator.controller;

import com.modelplatform.common.model.ErrorCode;
import com.modelplatform.common.model.NotificationAttempt;
import com.modelplatform.common.model.NotificationOutcome;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.common.model.RunError;
import com.modelplatform.common.model.RunOutcome;
import com.modelplatform.common.model.RunRequest;
import com.modelplatform.common.model.RunState;
import com.modelplatform.orchestrator.ledger.PromotionLedger;
import com.modelplatform.orchestrator.notifier.NotificationAttemptLog;
import com.modelplatform.orchestrator.service.ActiveRun;
import com.modelplatform.orchestrator.service.RetrainingOrchestrator;
import com.modelplatform.orchestrator.store.RunOutcomeStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(RetrainingController.class)
class RetrainingControllerTest {

    private static final String BASE = "/api/v1/retraining";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private RetrainingOrchestrator orchestrator;

    @MockBean
    private RunOutcomeStore outcomeStore;

    @MockBean
    private PromotionLedger ledger;

    @MockBean
    private NotificationAttemptLog attemptLog;

    private static PromotionRecord promotion() {
        return new PromotionRecord("promo-1", "prod-sentiment-classifier-v1", 1L, "runs:/abc/model",
                                   0.82, Instant.parse("2024-05-01T10:00:00Z"), "run-1");
    }

    @Nested
    @DisplayName("POST /runs")
    class Submit {

        @Test
        @DisplayName("promoted run → 200 with decision and promotion id")
        void promoted() {
            when(orchestrator.run(any())).thenReturn(Mono.just(RunOutcome.promoted("run-1", promotion())));

            webTestClient.post().uri(BASE + "/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RunRequest("run-1", Instant.now(), true, null))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runId").isEqualTo("run-1")
                .jsonPath("$.decision").isEqualTo("PROMOTED")
                .jsonPath("$.promotionId").isEqualTo("promo-1");

            ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
            verify(orchestrator).run(captor.capture());
            assertTrue(captor.getValue().forceRetrain());
        }

        @Test
        @DisplayName("rejected run → 409 with CONCURRENT_RUN_REJECTED")
        void rejected() {
            when(orchestrator.run(any())).thenReturn(Mono.just(RunOutcome.rejected("run-2", "run-1")));

            webTestClient.post().uri(BASE + "/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RunRequest("run-2", Instant.now(), false, null))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.decision").isEqualTo("REJECTED")
                .jsonPath("$.errorCode").isEqualTo("CONCURRENT_RUN_REJECTED");
        }

        @Test
        @DisplayName("run id too long to store → 400, orchestrator not called")
        void overlongRunId() {
            String runId = "x".repeat(RunRequest.MAX_RUN_ID_LENGTH + 1);

            webTestClient.post().uri(BASE + "/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RunRequest(runId, Instant.now(), false, null))
                .exchange()
                .expectStatus().isBadRequest();

            verify(orchestrator, never()).run(any());
        }

        @Test
        @DisplayName("failed run → 200 with the sanitised message only")
        void failed() {
            RunOutcome failed = RunOutcome.failed("run-3",
                new RunError(ErrorCode.TRAINING_FAILURE, "Candidate training failed or timed out"), null);
            when(orchestrator.run(any())).thenReturn(Mono.just(failed));

            webTestClient.post().uri(BASE + "/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RunRequest("run-3", Instant.now(), false, null))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.decision").isEqualTo("FAILED")
                .jsonPath("$.errorCode").isEqualTo("TRAINING_FAILURE")
                .jsonPath("$.message").isEqualTo("Candidate training failed or timed out");
        }
    }

    @Nested
    @DisplayName("run queries and cancellation")
    class Runs {

        @Test
        @DisplayName("cancel of an active run → 202, unknown → 404")
        void cancel() {
            when(orchestrator.cancel("run-1")).thenReturn(true);
            when(orchestrator.cancel("run-x")).thenReturn(false);

            webTestClient.post().uri(BASE + "/runs/run-1/cancel").exchange().expectStatus().isAccepted();
            webTestClient.post().uri(BASE + "/runs/run-x/cancel").exchange().expectStatus().isNotFound();
        }

        @Test
        @DisplayName("stored outcome → 200, unknown run → 404")
        void outcome() {
            when(outcomeStore.find("run-1")).thenReturn(Mono.just(RunOutcome.skipped("run-1")));
            when(outcomeStore.find("run-x")).thenReturn(Mono.empty());

            webTestClient.get().uri(BASE + "/runs/run-1").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.decision").isEqualTo("SKIPPED");
            webTestClient.get().uri(BASE + "/runs/run-x").exchange().expectStatus().isNotFound();
        }

        @Test
        @DisplayName("active run → 200 with state, none → 204")
        void active() {
            when(orchestrator.activeRun())
                .thenReturn(Optional.of(new ActiveRun("run-1", RunState.TRAINING, Instant.now(), false)))
                .thenReturn(Optional.empty());

            webTestClient.get().uri(BASE + "/runs/active").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runId").isEqualTo("run-1")
                .jsonPath("$.state").isEqualTo("TRAINING");
            webTestClient.get().uri(BASE + "/runs/active").exchange().expectStatus().isNoContent();
        }
    }

    @Nested
    @DisplayName("promotions")
    class Promotions {

        @Test
        @DisplayName("current head → 200, empty ledger → 204")
        void current() {
            when(ledger.readCurrent()).thenReturn(Mono.just(promotion())).thenReturn(Mono.just(PromotionRecord.NONE));

            webTestClient.get().uri(BASE + "/promotions/current").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.modelIdentifier").isEqualTo("prod-sentiment-classifier-v1")
                .jsonPath("$.artifactRef").isEqualTo("runs:/abc/model");
            webTestClient.get().uri(BASE + "/promotions/current").exchange().expectStatus().isNoContent();
        }

        @Test
        @DisplayName("history and attempt log are listed")
        void listings() {
            when(ledger.history()).thenReturn(Flux.just(promotion()));
            when(attemptLog.findByPromotionId("promo-1")).thenReturn(Flux.just(
                new NotificationAttempt("promo-1", 1, Instant.now(), NotificationOutcome.SUCCESS, 204)));

            webTestClient.get().uri(BASE + "/promotions").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$[0].promotionId").isEqualTo("promo-1");
            webTestClient.get().uri(BASE + "/promotions/promo-1/notifications").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].outcome").isEqualTo("SUCCESS")
                .jsonPath("$[0].httpStatus").isEqualTo(204);
        }
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        webTestClient.get().uri(BASE + "/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
