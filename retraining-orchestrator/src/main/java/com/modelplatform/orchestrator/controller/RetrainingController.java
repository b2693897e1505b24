package com.modelplatform.orchestrator.controller;

import com.modelplatform.common.model.NotificationAttempt;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.common.model.RunDecision;
import com.modelplatform.common.model.RunRequest;
import com.modelplatform.orchestrator.ledger.PromotionLedger;
import com.modelplatform.orchestrator.notifier.NotificationAttemptLog;
import com.modelplatform.orchestrator.service.ActiveRun;
import com.modelplatform.orchestrator.service.RetrainingOrchestrator;
import com.modelplatform.orchestrator.store.RunOutcomeStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/retraining")
public class RetrainingController {

    private final RetrainingOrchestrator orchestrator;
    private final RunOutcomeStore outcomeStore;
    private final PromotionLedger ledger;
    private final NotificationAttemptLog attemptLog;

    public RetrainingController(RetrainingOrchestrator orchestrator,
                                RunOutcomeStore outcomeStore,
                                PromotionLedger ledger,
                                NotificationAttemptLog attemptLog) {
        this.orchestrator = orchestrator;
        this.outcomeStore = outcomeStore;
        this.ledger       = ledger;
        this.attemptLog   = attemptLog;
    }

    /**
     * Runs synchronously to a terminal outcome; 409 when another run holds the pipeline,
     * 400 when the run id is too long to be stored.
     */
    @PostMapping("/runs")
    public Mono<ResponseEntity<RunOutcomeResponse>> submit(@RequestBody(required = false) RunRequest request) {
        RunRequest effective = request != null ? request : new RunRequest(null, null, false, null);
        if (effective.runId() != null && effective.runId().length() > RunRequest.MAX_RUN_ID_LENGTH) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return orchestrator.run(effective)
            .map(outcome -> {
                HttpStatus status = outcome.decision() == RunDecision.REJECTED ? HttpStatus.CONFLICT : HttpStatus.OK;
                return ResponseEntity.status(status).body(RunOutcomeResponse.from(outcome));
            });
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String runId) {
        return orchestrator.cancel(runId)
            ? ResponseEntity.accepted().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/runs/active")
    public ResponseEntity<ActiveRun> active() {
        return orchestrator.activeRun()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/runs/{runId}")
    public Mono<ResponseEntity<RunOutcomeResponse>> outcome(@PathVariable String runId) {
        return outcomeStore.find(runId)
            .map(outcome -> ResponseEntity.ok(RunOutcomeResponse.from(outcome)))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/promotions/current")
    public Mono<ResponseEntity<PromotionRecord>> currentPromotion() {
        return ledger.readCurrent()
            .map(head -> head.isNone()
                ? ResponseEntity.noContent().<PromotionRecord>build()
                : ResponseEntity.ok(head));
    }

    @GetMapping("/promotions")
    public Flux<PromotionRecord> promotions() {
        return ledger.history();
    }

    @GetMapping("/promotions/{promotionId}/notifications")
    public Flux<NotificationAttempt> notifications(@PathVariable String promotionId) {
        return attemptLog.findByPromotionId(promotionId);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
