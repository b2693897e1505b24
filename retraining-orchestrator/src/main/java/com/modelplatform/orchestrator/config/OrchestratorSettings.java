package com.modelplatform.orchestrator.config;

import java.time.Duration;

/**
 * Orchestrator-wide settings resolved once at startup by {@link OrchestratorConfig}.
 *
 * @param registryName      prefix of promoted model identifiers ({@code <name>-v<version>})
 * @param defaultDatasetRef dataset used when a run request does not name one
 * @param trainingTimeout   upper bound for one training call
 * @param signalTimeout     upper bound for one quality or drift call
 */
public record OrchestratorSettings(
    String registryName,
    String defaultDatasetRef,
    Duration trainingTimeout,
    Duration signalTimeout
) {}
