package com.modelplatform.orchestrator.guard;

import com.modelplatform.common.exception.RunCancelledException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;

/**
 * Run-scoped cancellation signal shared by every suspend point of one run.
 *
 * <p>{@link #guard(Mono)} races a stage against the token. When the token fires first,
 * the stage is cancelled (its subscription disposed, releasing any in-flight HTTP
 * exchange or transaction) and the guarded Mono fails with {@link RunCancelledException}.
 * A token that has already fired fails every later guard immediately.
 */
public final class CancellationToken {

    private final String runId;
    private final Sinks.Empty<Void> signal = Sinks.empty();
    private volatile boolean cancelled;

    public CancellationToken(String runId) {
        this.runId = runId;
    }

    /** A token for work that is not tied to an operator-cancellable run. */
    public static CancellationToken detached(String label) {
        return new CancellationToken(label);
    }

    /**
     * @return {@code true} if this call fired the token, {@code false} if it had already fired
     */
    public boolean cancel() {
        cancelled = true;
        return signal.tryEmitEmpty().isSuccess();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String runId() {
        return runId;
    }

    public <T> Mono<T> guard(Mono<T> stage) {
        Mono<T> cancellation = signal.asMono()
            .then(Mono.error(() -> new RunCancelledException(runId)));
        return Mono.firstWithSignal(List.of(stage, cancellation));
    }
}
