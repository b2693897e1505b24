package com.modelplatform.orchestrator.service;

import com.modelplatform.common.evaluation.EvaluationResult;
import com.modelplatform.common.evaluation.PromotionEvaluator;
import com.modelplatform.common.exception.InvalidDataException;
import com.modelplatform.common.exception.LedgerConflictException;
import com.modelplatform.common.exception.RetrainingException;
import com.modelplatform.common.exception.RunCancelledException;
import com.modelplatform.common.exception.SignalSourceException;
import com.modelplatform.common.exception.TrainingFailureException;
import com.modelplatform.common.model.Candidate;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.common.model.RunError;
import com.modelplatform.common.model.RunOutcome;
import com.modelplatform.common.model.RunRequest;
import com.modelplatform.common.model.RunState;
import com.modelplatform.common.trace.TraceContextUtil;
import com.modelplatform.orchestrator.config.OrchestratorSettings;
import com.modelplatform.orchestrator.guard.CancellationToken;
import com.modelplatform.orchestrator.guard.RunCancellationRegistry;
import com.modelplatform.orchestrator.guard.SingleFlightGuard;
import com.modelplatform.orchestrator.ledger.CommitResult;
import com.modelplatform.orchestrator.ledger.PromotionLedger;
import com.modelplatform.orchestrator.logger.RetrainingFlowLogger;
import com.modelplatform.orchestrator.notifier.DeploymentNotifier;
import com.modelplatform.orchestrator.signal.SignalSource;
import com.modelplatform.orchestrator.store.RunOutcomeStore;
import com.modelplatform.orchestrator.trainer.CandidateTrainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one retraining decision cycle through the {@link RunState} machine:
 *
 * <pre>
 *   IDLE → VALIDATING → TRAINING → EVALUATING → PROMOTING → NOTIFYING → DONE
 * </pre>
 *
 * <p>A run holds the {@link SingleFlightGuard} from {@code VALIDATING} entry until it
 * reaches a terminal state; a request arriving meanwhile is answered with a
 * {@code REJECTED} outcome and never queued. Every collaborator call is raced against the
 * run's {@link CancellationToken}.
 *
 * <p>Errors before the ledger commit fail the run. Once the ledger has accepted the
 * candidate the run reports {@code PROMOTED}, whatever happens to the notification.
 */
@Service
public class RetrainingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetrainingOrchestrator.class);

    static final String RESPONDED_STAGE = "RESPONDED";

    private final SignalSource signalSource;
    private final CandidateTrainer trainer;
    private final PromotionLedger ledger;
    private final PromotionEvaluator evaluator;
    private final DeploymentNotifier notifier;
    private final RunOutcomeStore outcomeStore;
    private final SingleFlightGuard guard;
    private final RunCancellationRegistry cancellationRegistry;
    private final RetrainingFlowLogger flowLogger;
    private final OrchestratorSettings settings;

    private final AtomicReference<RunContext> active = new AtomicReference<>();

    public RetrainingOrchestrator(
            SignalSource signalSource,
            CandidateTrainer trainer,
            PromotionLedger ledger,
            PromotionEvaluator evaluator,
            DeploymentNotifier notifier,
            RunOutcomeStore outcomeStore,
            SingleFlightGuard guard,
            RunCancellationRegistry cancellationRegistry,
            RetrainingFlowLogger flowLogger,
            OrchestratorSettings settings) {
        this.signalSource         = signalSource;
        this.trainer              = trainer;
        this.ledger               = ledger;
        this.evaluator            = evaluator;
        this.notifier             = notifier;
        this.outcomeStore         = outcomeStore;
        this.guard                = guard;
        this.cancellationRegistry = cancellationRegistry;
        this.flowLogger           = flowLogger;
        this.settings             = settings;
    }

    /**
     * Executes {@code request}, or returns the stored outcome when this run id already
     * completed. Never errors: every failure is folded into a {@code FAILED} outcome.
     */
    public Mono<RunOutcome> run(RunRequest request) {
        return Mono.defer(() -> {
            RunRequest resolved = request.withDefaults(settings.defaultDatasetRef());
            String runId = resolved.runId();

            Mono<RunOutcome> pipeline = outcomeStore.find(runId)
                .doOnNext(prior -> TraceContextUtil.withMdc(runId, () ->
                    log.info("Run already completed, returning stored outcome. runId={} decision={}",
                             runId, prior.decision())))
                .onErrorResume(e -> {
                    log.warn("Outcome store unreadable, executing run. runId={} reason={}", runId, e.getMessage());
                    return Mono.empty();
                })
                .switchIfEmpty(Mono.defer(() -> execute(resolved)))
                .doOnEach(flowLogger.stage(RESPONDED_STAGE));

            return TraceContextUtil.withRunId(pipeline, runId);
        });
    }

    /**
     * Fires the cancellation token of the active run with this id.
     *
     * @return {@code false} if no such run is active
     */
    public boolean cancel(String runId) {
        return cancellationRegistry.cancel(runId);
    }

    public Optional<ActiveRun> activeRun() {
        return Optional.ofNullable(active.get()).map(RunContext::snapshot);
    }

    // ── run lifecycle ────────────────────────────────────────────────────────

    private Mono<RunOutcome> execute(RunRequest request) {
        String runId = request.runId();
        if (!guard.tryAcquire(runId)) {
            String holder = guard.holder().orElse("unknown");
            TraceContextUtil.withMdc(runId, () ->
                log.info("Run rejected, pipeline busy. runId={} holderRunId={}", runId, holder));
            return Mono.just(RunOutcome.rejected(runId, holder));
        }

        // The first lookup ran without the lock; the run may have finished since.
        return outcomeStore.find(runId)
            .onErrorResume(e -> {
                log.warn("Outcome store unreadable under lock, executing run. runId={} reason={}",
                         runId, e.getMessage());
                return Mono.empty();
            })
            .doOnNext(prior -> {
                guard.release(runId);
                TraceContextUtil.withMdc(runId, () ->
                    log.info("Run completed while waiting for the lock, returning stored outcome. runId={} decision={}",
                             runId, prior.decision()));
            })
            .doOnCancel(() -> guard.release(runId))
            .switchIfEmpty(Mono.defer(() -> start(request)));
    }

    private Mono<RunOutcome> start(RunRequest request) {
        String runId = request.runId();
        CancellationToken token = cancellationRegistry.register(runId);
        RunContext ctx = new RunContext(request, token, flowLogger);
        active.set(ctx);
        long startTime = System.currentTimeMillis();
        TraceContextUtil.withMdc(runId, () ->
            log.info("Run started. runId={} forceRetrain={} datasetRef={}",
                     runId, request.forceRetrain(), request.datasetRef()));

        return Mono.defer(() -> validate(ctx))
            .onErrorResume(e -> Mono.just(fail(ctx, e)))
            .flatMap(this::persist)
            .doOnNext(outcome -> {
                // Lock is free before the caller sees the outcome.
                release(ctx);
                flowLogger.outcome(outcome, System.currentTimeMillis() - startTime);
            })
            .doOnCancel(() -> abandoned(ctx))
            .doFinally(signal -> release(ctx));
    }

    private Mono<RunOutcome> validate(RunContext ctx) {
        ctx.transition(RunState.VALIDATING);
        String runId = ctx.runId();

        return ctx.token().guard(signalSource.getQualityVerdict(runId, ctx.datasetRef()))
            .switchIfEmpty(Mono.error(() -> new SignalSourceException(runId, "no quality verdict", null)))
            .flatMap(quality -> {
                if (!quality.passed()) {
                    TraceContextUtil.withMdc(runId, () ->
                        log.warn("Data quality gate failed. runId={} failedExpectations={}",
                                 runId, quality.failedExpectations()));
                    return Mono.error(new InvalidDataException(runId, quality.failedExpectations()));
                }
                if (ctx.forceRetrain()) {
                    log.info("Force retrain requested, drift not consulted. runId={}", runId);
                    return train(ctx);
                }
                return ctx.token().guard(ledger.readCurrent())
                    .flatMap(current -> checkDrift(ctx, current));
            });
    }

    /**
     * With no model of record the drift call gets a {@code null} model ref; the first
     * model is bootstrapped with {@code forceRetrain}.
     */
    private Mono<RunOutcome> checkDrift(RunContext ctx, PromotionRecord current) {
        String runId = ctx.runId();
        String currentModelRef = current.isNone() ? null : current.artifactRef();
        return ctx.token().guard(signalSource.getDriftVerdict(runId, ctx.datasetRef(), currentModelRef))
            .switchIfEmpty(Mono.error(() -> new SignalSourceException(runId, "no drift verdict", null)))
            .flatMap(drift -> {
                log.info("Drift verdict. runId={} driftDetected={} performanceDegraded={} summaryRef={}",
                         runId, drift.driftDetected(), drift.performanceDegraded(), drift.summaryRef());
                if (!drift.retrainingNeeded()) {
                    ctx.transition(RunState.SKIPPED);
                    return Mono.just(RunOutcome.skipped(runId));
                }
                return train(ctx);
            });
    }

    private Mono<RunOutcome> train(RunContext ctx) {
        ctx.transition(RunState.TRAINING);
        String runId = ctx.runId();
        Duration timeout = settings.trainingTimeout();

        Mono<Candidate> training = trainer.train(runId, ctx.datasetRef())
            .timeout(timeout, Mono.error(() ->
                new TrainingFailureException(runId, "training exceeded " + timeout)))
            .onErrorMap(e -> !(e instanceof RetrainingException),
                        e -> new TrainingFailureException(runId, "trainer call failed", e))
            .switchIfEmpty(Mono.error(() ->
                new TrainingFailureException(runId, "trainer returned no candidate")));

        return ctx.token().guard(training)
            .flatMap(candidate -> {
                ctx.candidate(candidate);
                log.info("Candidate trained. runId={} artifactRef={} metric={}",
                         runId, candidate.artifactRef(), candidate.metricValue());
                return evaluate(ctx, candidate);
            });
    }

    private Mono<RunOutcome> evaluate(RunContext ctx, Candidate candidate) {
        ctx.transition(RunState.EVALUATING);
        String runId = ctx.runId();

        return ctx.token().guard(ledger.readCurrent())
            .flatMap(current -> {
                EvaluationResult result = evaluator.evaluate(candidate, current);
                flowLogger.candidateEvaluated(runId, candidate, current, result.accepted(), result.reason());
                if (!result.accepted()) {
                    ctx.transition(RunState.DONE);
                    return Mono.just(RunOutcome.notPromoted(runId, candidate.metricValue()));
                }
                return promote(ctx, candidate, current.modelIdentifier());
            });
    }

    private Mono<RunOutcome> promote(RunContext ctx, Candidate candidate, String expectedPriorId) {
        ctx.transition(RunState.PROMOTING);
        String runId = ctx.runId();

        return ctx.token().guard(ledger.tryCommit(candidate, expectedPriorId))
            .flatMap(result -> {
                if (result instanceof CommitResult.Conflict conflict) {
                    return Mono.error(new LedgerConflictException(
                        runId, conflict.expectedPriorId(), conflict.actualHeadId()));
                }
                PromotionRecord record = ((CommitResult.Committed) result).record();
                ctx.committed(record);
                ctx.transition(RunState.NOTIFYING);
                return notifyDeployment(ctx, record)
                    .then(Mono.fromCallable(() -> {
                        ctx.transition(RunState.DONE);
                        return RunOutcome.promoted(runId, record);
                    }));
            });
    }

    /** Notification never changes the run's decision; every error ends here. */
    private Mono<Void> notifyDeployment(RunContext ctx, PromotionRecord record) {
        String runId = ctx.runId();
        return notifier.notify(record, ctx.token())
            .doOnNext(attempt -> log.info("Deployment notification finished. runId={} promotionId={} outcome={} attempts={}",
                                          runId, record.promotionId(), attempt.outcome(), attempt.attemptNumber()))
            .onErrorResume(e -> {
                if (e instanceof RunCancelledException) {
                    log.warn("Run cancelled while notifying, promotion stands. runId={} promotionId={}",
                             runId, record.promotionId());
                } else {
                    log.error("Deployment notification aborted, promotion stands. runId={} promotionId={}",
                              runId, record.promotionId(), e);
                }
                return Mono.empty();
            })
            .then();
    }

    // ── terminal handling ────────────────────────────────────────────────────

    private RunOutcome fail(RunContext ctx, Throwable error) {
        String runId = ctx.runId();
        PromotionRecord committed = ctx.committed();
        if (committed != null) {
            if (ctx.state() == RunState.NOTIFYING) {
                ctx.transition(RunState.DONE);
            }
            log.error("Run errored after commit, reporting promotion. runId={} promotionId={}",
                      runId, committed.promotionId(), error);
            return RunOutcome.promoted(runId, committed);
        }

        RunError runError = RunErrors.from(error);
        RunState failedIn = ctx.state();
        ctx.failIfActive();
        TraceContextUtil.withMdc(runId, () -> {
            if (error instanceof RunCancelledException) {
                log.warn("Run cancelled. runId={} state={}", runId, failedIn);
            } else {
                log.error("Run failed. runId={} state={} errorCode={}", runId, failedIn, runError.code(), error);
            }
        });
        return RunOutcome.failed(runId, runError, ctx.candidateMetric());
    }

    private Mono<RunOutcome> persist(RunOutcome outcome) {
        return outcomeStore.save(outcome)
            .onErrorResume(e -> {
                log.error("Run outcome not persisted. runId={} decision={}", outcome.runId(), outcome.decision(), e);
                return Mono.empty();
            })
            .then(Mono.just(outcome));
    }

    /**
     * The subscriber went away mid-run. The cancel signal disposes the in-flight stage on
     * its way upstream; this only records what happened.
     */
    private void abandoned(RunContext ctx) {
        String runId = ctx.runId();
        if (ctx.state().isTerminal()) {
            release(ctx);
            return;
        }
        RunOutcome outcome = fail(ctx, new RunCancelledException(runId));
        log.warn("Run subscription cancelled. runId={} decision={}", runId, outcome.decision());
        persist(outcome).subscribe();
        release(ctx);
    }

    private void release(RunContext ctx) {
        String runId = ctx.runId();
        guard.release(runId);
        cancellationRegistry.unregister(runId, ctx.token());
        active.compareAndSet(ctx, null);
    }
}
