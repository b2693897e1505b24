package com.modelplatform.scheduler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.modelplatform.scheduler.strategy.RetrainTempoStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class SchedulerConfig {

    @Value("${services.orchestrator.base-url}")
    private String orchestratorUrl;

    @Value("${scheduler.interval:PT24H}")
    private Duration interval;

    @Value("${scheduler.retry-interval:PT5M}")
    private Duration retryInterval;

    @Value("${scheduler.fallback-interval:PT1H}")
    private Duration fallbackInterval;

    @Bean
    public WebClient orchestratorClient(WebClient.Builder builder) {
        return builder.baseUrl(orchestratorUrl).build();
    }

    @Bean
    public RetrainTempoStrategy retrainTempoStrategy() {
        return new RetrainTempoStrategy(interval, retryInterval, fallbackInterval);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
