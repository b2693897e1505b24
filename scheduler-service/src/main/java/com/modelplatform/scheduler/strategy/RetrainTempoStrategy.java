package com.modelplatform.scheduler.strategy;

import com.modelplatform.common.model.RunDecision;

import java.time.Duration;

/**
 * Outcome-aware tempo for the retraining loop.
 *
 * <ul>
 *   <li>REJECTED: another run holds the pipeline, retry soon ({@code retryInterval})</li>
 *   <li>FAILED, or orchestrator unreachable: back off ({@code fallbackInterval})</li>
 *   <li>SKIPPED / TRAINED_NOT_PROMOTED / PROMOTED: regular cadence ({@code interval})</li>
 * </ul>
 */
public final class RetrainTempoStrategy {

    public static final Duration DEFAULT_INTERVAL          = Duration.ofHours(24);
    public static final Duration DEFAULT_RETRY_INTERVAL    = Duration.ofMinutes(5);
    public static final Duration DEFAULT_FALLBACK_INTERVAL = Duration.ofHours(1);

    private final Duration interval;
    private final Duration retryInterval;
    private final Duration fallbackInterval;

    public RetrainTempoStrategy(Duration interval, Duration retryInterval, Duration fallbackInterval) {
        if (interval.isNegative() || interval.isZero()
            || retryInterval.isNegative() || retryInterval.isZero()
            || fallbackInterval.isNegative() || fallbackInterval.isZero()) {
            throw new IllegalArgumentException("scheduler intervals must be positive");
        }
        this.interval         = interval;
        this.retryInterval    = retryInterval;
        this.fallbackInterval = fallbackInterval;
    }

    public static RetrainTempoStrategy defaults() {
        return new RetrainTempoStrategy(DEFAULT_INTERVAL, DEFAULT_RETRY_INTERVAL, DEFAULT_FALLBACK_INTERVAL);
    }

    public Duration resolve(RunDecision decision) {
        return switch (decision) {
            case REJECTED -> retryInterval;
            case FAILED   -> fallbackInterval;
            case SKIPPED, TRAINED_NOT_PROMOTED, PROMOTED -> interval;
        };
    }

    /** Interval after a cycle that got no decision at all. */
    public Duration unreachable() {
        return fallbackInterval;
    }

    public Duration interval() {
        return interval;
    }
}
