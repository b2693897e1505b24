package com.modelplatform.orchestrator.signal;

import com.modelplatform.common.exception.SignalSourceException;
import com.modelplatform.orchestrator.config.OrchestratorSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpSignalSourceTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private HttpSignalSource source(ExchangeFunction exchange, Duration timeout) {
        WebClient client = WebClient.builder()
            .baseUrl("http://monitoring")
            .exchangeFunction(request -> {
                lastRequest.set(request);
                return exchange.exchange(request);
            })
            .build();
        return new HttpSignalSource(client,
            new OrchestratorSettings("registry", "data/raw/feedback.csv", Duration.ofMinutes(1), timeout));
    }

    private static ExchangeFunction json(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    @Nested
    @DisplayName("getQualityVerdict()")
    class Quality {

        @Test
        @DisplayName("posts to the validate endpoint with the run id header and keeps expectation order")
        void parsesVerdict() {
            HttpSignalSource source = source(json(HttpStatus.OK,
                "{\"passed\":false,\"failedExpectations\":[\"not_null:text\",\"in_set:label\"]}"),
                Duration.ofSeconds(5));

            StepVerifier.create(source.getQualityVerdict("run-1", "data/raw/feedback.csv"))
                .assertNext(verdict -> {
                    assertFalse(verdict.passed());
                    assertEquals(List.of("not_null:text", "in_set:label"), verdict.failedExpectations());
                })
                .verifyComplete();

            ClientRequest request = lastRequest.get();
            assertEquals(HttpMethod.POST, request.method());
            assertEquals("/api/v1/quality/validate", request.url().getPath());
            assertEquals("run-1", request.headers().getFirst("X-Run-Id"));
        }

        @Test
        @DisplayName("server error → SignalSourceException")
        void serverError() {
            HttpSignalSource source = source(json(HttpStatus.INTERNAL_SERVER_ERROR, "{}"), Duration.ofSeconds(5));

            StepVerifier.create(source.getQualityVerdict("run-2", "d"))
                .expectError(SignalSourceException.class)
                .verify();
        }

        @Test
        @DisplayName("no answer within the signal timeout → SignalSourceException")
        void timeout() {
            HttpSignalSource source = source(request -> Mono.never(), Duration.ofMillis(100));

            StepVerifier.create(source.getQualityVerdict("run-3", "d"))
                .expectError(SignalSourceException.class)
                .verify(Duration.ofSeconds(5));
        }
    }

    @Nested
    @DisplayName("getDriftVerdict()")
    class Drift {

        @Test
        @DisplayName("parses flags and informational metrics")
        void parsesVerdict() {
            HttpSignalSource source = source(json(HttpStatus.OK,
                "{\"driftDetected\":true,\"performanceDegraded\":false,\"summaryRef\":\"reports/drift.html\","
                + "\"currentMetric\":0.71,\"referenceMetric\":0.80}"),
                Duration.ofSeconds(5));

            StepVerifier.create(source.getDriftVerdict("run-4", "d", "runs:/abc/model"))
                .assertNext(verdict -> {
                    assertTrue(verdict.driftDetected());
                    assertFalse(verdict.performanceDegraded());
                    assertTrue(verdict.retrainingNeeded());
                    assertEquals("reports/drift.html", verdict.summaryRef());
                    assertEquals(0.71, verdict.currentMetric());
                })
                .verifyComplete();

            assertEquals("/api/v1/drift/analyze", lastRequest.get().url().getPath());
        }

        @Test
        @DisplayName("transport failure → SignalSourceException")
        void transportFailure() {
            HttpSignalSource source = source(request -> Mono.error(new IllegalStateException("connection refused")),
                                             Duration.ofSeconds(5));

            StepVerifier.create(source.getDriftVerdict("run-5", "d", "ref"))
                .expectError(SignalSourceException.class)
                .verify();
        }
    }
}
