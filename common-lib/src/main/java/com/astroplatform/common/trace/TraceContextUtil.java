package com.astroplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries a per-turn traceId through reactive chat pipelines.
 *
 * <p>The Reactor Context holds the traceId. MDC is written only while a log statement
 * runs, never left populated on a thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(turn, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. {@code contextWrite}
     * propagates upstream, so apply it last when assembling the turn.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** The traceId of the context, or {@code "unknown"}; never null. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Runs {@code logAction} with {@code traceId} in MDC, then clears it. */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
