package com.modelplatform.orchestrator.notifier;

import java.time.Duration;

/**
 * Deployment-notification switches and retry budget. Read once per
 * {@link DeploymentNotifier#notify} call.
 *
 * @param enabled        administrative switch; off means no outbound call at all
 * @param maxAttempts    total attempts per promotion, including the first
 * @param attemptTimeout upper bound for a single outbound call
 * @param baseBackoff    delay after the first failed attempt
 * @param maxBackoff     cap for the exponential backoff
 */
public record NotifierSettings(
    boolean enabled,
    int maxAttempts,
    Duration attemptTimeout,
    Duration baseBackoff,
    Duration maxBackoff
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

    public NotifierSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (baseBackoff.isNegative() || maxBackoff.compareTo(baseBackoff) < 0) {
            throw new IllegalArgumentException(
                "backoff must satisfy 0 <= base <= max, was base=" + baseBackoff + " max=" + maxBackoff);
        }
    }

    public static NotifierSettings defaults(boolean enabled) {
        return new NotifierSettings(enabled, DEFAULT_MAX_ATTEMPTS, DEFAULT_ATTEMPT_TIMEOUT,
                                    DEFAULT_BASE_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    /**
     * Delay before the attempt that follows failed attempt number {@code failedAttempt}
     * (1-based): {@code min(base * 2^(failedAttempt-1), max)}. Non-decreasing in
     * {@code failedAttempt}.
     */
    public Duration backoffAfter(int failedAttempt) {
        int exponent = Math.min(Math.max(failedAttempt - 1, 0), 30);
        Duration delay = baseBackoff.multipliedBy(1L << exponent);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
