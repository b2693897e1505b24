package com.modelplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetrainingOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(RetrainingOrchestratorApplication.class, args);
    }
}
