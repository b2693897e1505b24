package com.modelplatform.orchestrator.notifier;

import com.modelplatform.common.exception.NotificationExhaustedException;
import com.modelplatform.common.exception.RunCancelledException;
import com.modelplatform.common.model.NotificationAttempt;
import com.modelplatform.common.model.NotificationOutcome;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.orchestrator.guard.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Tells the deployment system about a committed promotion.
 *
 * <p>Call sequence per {@link #notify}:
 * <ol>
 *   <li>administratively disabled → {@link NotificationOutcome#DISABLED}, no call</li>
 *   <li>trigger not configured → {@link NotificationOutcome#MISCONFIGURED}, no call</li>
 *   <li>another notify for the same promotion in flight → {@link NotificationOutcome#IN_FLIGHT}</li>
 *   <li>a success already logged → {@link NotificationOutcome#ALREADY_DELIVERED}</li>
 *   <li>otherwise up to {@code maxAttempts} calls, each bounded by {@code attemptTimeout}
 *       and logged as one attempt row, with exponential backoff in between</li>
 * </ol>
 *
 * <p>Failure is never propagated: after the last attempt the exhaustion is logged and the
 * last attempt is returned. The only error this Mono emits is
 * {@link RunCancelledException} when the run's token fires.
 */
@Component
public class DeploymentNotifier {

    private static final Logger log = LoggerFactory.getLogger(DeploymentNotifier.class);

    private final DeploymentTrigger trigger;
    private final NotificationAttemptLog attemptLog;
    private final NotifierSettings settings;
    private final Map<String, String> inFlight = new ConcurrentHashMap<>();

    public DeploymentNotifier(DeploymentTrigger trigger,
                              NotificationAttemptLog attemptLog,
                              NotifierSettings settings) {
        this.trigger    = trigger;
        this.attemptLog = attemptLog;
        this.settings   = settings;
    }

    /**
     * @param promotion a record the ledger has already committed
     * @param token     the promoting run's cancellation token
     * @return the final attempt, or a synthetic attempt (number 0) when no call was made
     */
    public Mono<NotificationAttempt> notify(PromotionRecord promotion, CancellationToken token) {
        return Mono.defer(() -> {
            String promotionId = promotion.promotionId();
            NotifierSettings current = settings;

            if (!current.enabled()) {
                log.info("Deployment trigger disabled. promotionId={} modelIdentifier={}",
                         promotionId, promotion.modelIdentifier());
                return Mono.just(NotificationAttempt.skipped(promotionId, NotificationOutcome.DISABLED));
            }
            if (!trigger.isConfigured()) {
                log.warn("Deployment trigger enabled but not configured. promotionId={}", promotionId);
                return Mono.just(NotificationAttempt.skipped(promotionId, NotificationOutcome.MISCONFIGURED));
            }
            if (inFlight.putIfAbsent(promotionId, token.runId()) != null) {
                log.info("Notification already in flight. promotionId={} holderRunId={}",
                         promotionId, inFlight.get(promotionId));
                return Mono.just(NotificationAttempt.skipped(promotionId, NotificationOutcome.IN_FLIGHT));
            }

            return attemptLog.hasSuccess(promotionId)
                .onErrorResume(e -> {
                    log.warn("Attempt log unreadable, sending anyway. promotionId={} reason={}",
                             promotionId, e.getMessage());
                    return Mono.just(false);
                })
                .flatMap(delivered -> {
                    if (Boolean.TRUE.equals(delivered)) {
                        log.info("Promotion already delivered. promotionId={}", promotionId);
                        return Mono.just(NotificationAttempt.skipped(promotionId, NotificationOutcome.ALREADY_DELIVERED));
                    }
                    return attempt(promotion, 1, current, token);
                })
                .doFinally(signal -> inFlight.remove(promotionId));
        });
    }

    private Mono<NotificationAttempt> attempt(PromotionRecord promotion, int attemptNumber,
                                              NotifierSettings current, CancellationToken token) {
        String promotionId = promotion.promotionId();

        Mono<NotificationAttempt> call = Mono.defer(() -> {
            Instant sentAt = Instant.now();
            return trigger.dispatch(DeploymentRequest.from(promotion))
                .timeout(current.attemptTimeout())
                .map(status -> new NotificationAttempt(promotionId, attemptNumber, sentAt,
                                                       NotificationOutcome.SUCCESS, status))
                .defaultIfEmpty(new NotificationAttempt(promotionId, attemptNumber, sentAt,
                                                        NotificationOutcome.SUCCESS, null))
                .onErrorResume(e -> Mono.just(failedAttempt(promotionId, attemptNumber, sentAt, e)));
        });

        return token.guard(call)
            .flatMap(this::record)
            .flatMap(result -> {
                if (result.outcome() == NotificationOutcome.SUCCESS) {
                    log.info("Deployment triggered. promotionId={} attempt={} status={}",
                             promotionId, attemptNumber, result.httpStatus());
                    return Mono.just(result);
                }
                if (attemptNumber >= current.maxAttempts()) {
                    NotificationExhaustedException exhausted =
                        new NotificationExhaustedException(token.runId(), promotionId, attemptNumber);
                    log.warn("Deployment notification exhausted, promotion stands. promotionId={} attempts={} lastOutcome={} lastStatus={}",
                             promotionId, attemptNumber, result.outcome(), result.httpStatus(), exhausted);
                    return Mono.just(result);
                }
                Duration backoff = current.backoffAfter(attemptNumber);
                log.warn("Deployment notification failed, retrying. promotionId={} attempt={} outcome={} status={} backoffMs={}",
                         promotionId, attemptNumber, result.outcome(), result.httpStatus(), backoff.toMillis());
                return token.guard(Mono.delay(backoff))
                    .then(Mono.defer(() -> attempt(promotion, attemptNumber + 1, current, token)));
            });
    }

    private Mono<NotificationAttempt> record(NotificationAttempt attempt) {
        return attemptLog.append(attempt)
            .onErrorResume(e -> {
                log.error("Notification attempt not recorded. promotionId={} attempt={}",
                          attempt.promotionId(), attempt.attemptNumber(), e);
                return Mono.just(attempt);
            })
            .defaultIfEmpty(attempt);
    }

    private static NotificationAttempt failedAttempt(String promotionId, int attemptNumber,
                                                     Instant sentAt, Throwable error) {
        if (error instanceof TimeoutException) {
            return new NotificationAttempt(promotionId, attemptNumber, sentAt, NotificationOutcome.TIMEOUT, null);
        }
        Integer status = error instanceof DeploymentTriggerException rejected ? rejected.getHttpStatus() : null;
        log.debug("Deployment trigger call failed. promotionId={} attempt={} reason={}",
                  promotionId, attemptNumber, error.getMessage());
        return new NotificationAttempt(promotionId, attemptNumber, sentAt, NotificationOutcome.FAILURE, status);
    }
}
