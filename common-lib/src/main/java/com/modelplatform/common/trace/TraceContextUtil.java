package com.modelplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Run-id propagation for reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the run id inside a pipeline.
 * MDC is only written as a temporary bridge around a log statement, never as a
 * persistent ThreadLocal store.
 *
 * <pre>
 *     return TraceContextUtil.withRunId(pipeline, request.runId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private TraceContextUtil() {}

    /**
     * Stores {@code runId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly: {@code contextWrite} propagates upstream on subscription.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /**
     * @return the run id from the context, or {@code "unknown"}; never {@code null}
     */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code runId} into MDC for the duration of {@code logAction}, then
     * removes it. Only for logging side-effects.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
