package com.modelplatform.orchestrator.service;

import com.modelplatform.common.model.NotificationOutcome;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.common.model.RunDecision;
import com.modelplatform.common.model.RunOutcome;
import com.modelplatform.orchestrator.guard.CancellationToken;
import com.modelplatform.orchestrator.guard.SingleFlightGuard;
import com.modelplatform.orchestrator.ledger.PromotionLedger;
import com.modelplatform.orchestrator.notifier.DeploymentNotifier;
import com.modelplatform.orchestrator.notifier.NotificationAttemptLog;
import com.modelplatform.orchestrator.store.RunOutcomeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Startup check for a process that died between the ledger commit and the end of its run.
 *
 * <p>The ledger head is the source of truth. If the run that promoted it has no stored
 * outcome, a {@code PROMOTED} outcome is inferred from the head. If the promotion has no
 * notification attempt rows at all, the notifier is invoked for it once more. The check
 * takes the pipeline lock so it cannot race a run that is still in flight.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    static final String LOCK_HOLDER = "startup-reconciliation";

    private final PromotionLedger ledger;
    private final RunOutcomeStore outcomeStore;
    private final NotificationAttemptLog attemptLog;
    private final DeploymentNotifier notifier;
    private final SingleFlightGuard guard;

    public ReconciliationService(PromotionLedger ledger,
                                 RunOutcomeStore outcomeStore,
                                 NotificationAttemptLog attemptLog,
                                 DeploymentNotifier notifier,
                                 SingleFlightGuard guard) {
        this.ledger       = ledger;
        this.outcomeStore = outcomeStore;
        this.attemptLog   = attemptLog;
        this.notifier     = notifier;
        this.guard        = guard;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        reconcile().subscribe(
            report -> log.info("Startup reconciliation finished. head={} promotionId={} outcomeInferred={} notification={} skipped={}",
                               report.headModelIdentifier(), report.promotionId(), report.outcomeInferred(),
                               report.notificationOutcome(), report.skippedReason()),
            e -> log.error("Startup reconciliation failed", e));
    }

    /** Never errors; storage failures are logged and reported as a skipped check. */
    public Mono<ReconciliationReport> reconcile() {
        return Mono.defer(() -> {
            if (!guard.tryAcquire(LOCK_HOLDER)) {
                String holder = guard.holder().orElse("unknown");
                log.info("Reconciliation skipped, run in flight. holderRunId={}", holder);
                return Mono.just(ReconciliationReport.skipped(null, "run in flight: " + holder));
            }
            return ledger.readCurrent()
                .flatMap(head -> head.isNone()
                    ? Mono.just(ReconciliationReport.skipped(head.modelIdentifier(), "no promotion yet"))
                    : reconcileHead(head))
                .onErrorResume(e -> {
                    log.error("Reconciliation aborted", e);
                    return Mono.just(ReconciliationReport.skipped(null, "storage unavailable"));
                })
                .doFinally(signal -> guard.release(LOCK_HOLDER));
        });
    }

    private Mono<ReconciliationReport> reconcileHead(PromotionRecord head) {
        return inferOutcome(head)
            .flatMap(inferred -> resendNotification(head)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .map(outcome -> new ReconciliationReport(
                    head.modelIdentifier(), head.promotionId(), inferred, outcome.orElse(null), null)));
    }

    private Mono<Boolean> inferOutcome(PromotionRecord head) {
        String runId = head.promotedFromRunId();
        RunOutcome inferred = new RunOutcome(runId, RunDecision.PROMOTED, null,
                                             head.promotedAt(), head.promotionId(), head.metricValue());
        return outcomeStore.find(runId)
            .map(existing -> false)
            .switchIfEmpty(Mono.defer(() -> {
                log.warn("Promoting run has no outcome, inferring PROMOTED. runId={} promotionId={}",
                         runId, head.promotionId());
                return outcomeStore.save(inferred).thenReturn(true);
            }));
    }

    private Mono<NotificationOutcome> resendNotification(PromotionRecord head) {
        String promotionId = head.promotionId();
        return attemptLog.countByPromotionId(promotionId)
            .defaultIfEmpty(0L)
            .flatMap(count -> {
                if (count > 0) {
                    return Mono.empty();
                }
                log.warn("Promotion was never notified, notifying now. promotionId={}", promotionId);
                return notifier.notify(head, CancellationToken.detached(LOCK_HOLDER))
                    .map(attempt -> attempt.outcome());
            });
    }
}
