package com.dataplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Trace id propagation for acquisition pipelines.
 *
 * <p>The Reactor Context carries the trace id through a request's {@code Mono}. MDC is
 * only populated for the span of a single log call, because reactive operators hop
 * threads and a lingering ThreadLocal would tag unrelated requests.
 */
public final class TraceContext {

    public static final String TRACE_ID_KEY = "traceId";

    private static final String UNKNOWN = "unknown";

    private TraceContext() {}

    /** Attaches {@code traceId} to the subscriber context of {@code mono}. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId));
    }

    /** The trace id stored in {@code ctx}, or {@code "unknown"}; never {@code null}. */
    public static String traceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with {@code traceId} in MDC, restoring the previous value afterwards. */
    public static void withMdc(String traceId, Runnable logAction) {
        String previous = MDC.get(TRACE_ID_KEY);
        MDC.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId);
        try {
            logAction.run();
        } finally {
            if (previous == null) {
                MDC.remove(TRACE_ID_KEY);
            } else {
                MDC.put(TRACE_ID_KEY, previous);
            }
        }
    }
}
