package com.cropadvisor.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the per-run traceId through reactive pipelines.
 *
 * <p>The Reactor Context holds the traceId. MDC is written only for the duration of a
 * single log call and cleared straight after, so pooled threads never leak a stale id.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(run, traceId);
 *     ...
 *     Mono.deferContextual(ctx -&gt; ... TraceContextUtil.getTraceId(ctx) ...)
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Never {@code null}; {@value #UNKNOWN} when the context carries no traceId. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** Uses the caller-supplied id when present, otherwise mints a new one. */
    public static String resolve(String suppliedTraceId) {
        return suppliedTraceId == null || suppliedTraceId.isBlank()
            ? UUID.randomUUID().toString()
            : suppliedTraceId.trim();
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
