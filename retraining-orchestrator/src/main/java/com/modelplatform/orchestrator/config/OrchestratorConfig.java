package com.modelplatform.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.modelplatform.common.evaluation.PromotionEvaluator;
import com.modelplatform.orchestrator.notifier.GitHubDispatchSettings;
import com.modelplatform.orchestrator.notifier.NotifierSettings;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class OrchestratorConfig {

    @Value("${services.monitoring.base-url}")
    private String monitoringUrl;

    @Value("${services.trainer.base-url}")
    private String trainerUrl;

    @Value("${notifier.github.base-url:https://api.github.com}")
    private String githubApiUrl;

    @Value("${retraining.registry-name:prod-sentiment-classifier}")
    private String registryName;

    @Value("${retraining.default-dataset-ref:data/raw/feedback.csv}")
    private String defaultDatasetRef;

    @Value("${retraining.training-timeout:PT2H}")
    private Duration trainingTimeout;

    @Value("${retraining.signal-timeout:PT10M}")
    private Duration signalTimeout;

    @Value("${retraining.epsilon:0.0}")
    private double epsilon;

    @Value("${retraining.minimum-metric:0.75}")
    private double minimumMetric;

    // ── deployment trigger (ENABLE_CD_TRIGGER and friends) ───────────────────
    @Value("${notifier.enabled:false}")
    private boolean notifierEnabled;

    @Value("${notifier.max-attempts:3}")
    private int notifierMaxAttempts;

    @Value("${notifier.attempt-timeout:PT30S}")
    private Duration notifierAttemptTimeout;

    @Value("${notifier.base-backoff:PT2S}")
    private Duration notifierBaseBackoff;

    @Value("${notifier.max-backoff:PT30S}")
    private Duration notifierMaxBackoff;

    @Value("${notifier.github.token:}")
    private String githubToken;

    @Value("${notifier.github.owner:}")
    private String githubOwner;

    @Value("${notifier.github.repo:}")
    private String githubRepo;

    @Value("${notifier.github.workflow:cd_pipeline.yml}")
    private String githubWorkflow;

    @Value("${notifier.github.ref:main}")
    private String githubRef;

    @Bean
    public OrchestratorSettings orchestratorSettings() {
        return new OrchestratorSettings(registryName, defaultDatasetRef, trainingTimeout, signalTimeout);
    }

    @Bean
    public PromotionEvaluator promotionEvaluator() {
        return new PromotionEvaluator(epsilon, minimumMetric);
    }

    @Bean
    public NotifierSettings notifierSettings() {
        return new NotifierSettings(notifierEnabled, notifierMaxAttempts, notifierAttemptTimeout,
                                    notifierBaseBackoff, notifierMaxBackoff);
    }

    @Bean
    public GitHubDispatchSettings gitHubDispatchSettings() {
        return new GitHubDispatchSettings(githubToken, githubOwner, githubRepo, githubWorkflow, githubRef);
    }

    @Bean
    public WebClient monitoringClient(WebClient.Builder builder) {
        return builder.baseUrl(monitoringUrl).filter(loggingFilter()).build();
    }

    @Bean
    public WebClient trainerClient(WebClient.Builder builder) {
        return builder.baseUrl(trainerUrl).filter(loggingFilter()).build();
    }

    /**
     * The deployment trigger gets its own connector: the notifier bounds each attempt at
     * 30s, so the transport must give up no later than that.
     */
    @Bean
    public WebClient deploymentTriggerClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(30))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(30, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(githubApiUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(OrchestratorConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
