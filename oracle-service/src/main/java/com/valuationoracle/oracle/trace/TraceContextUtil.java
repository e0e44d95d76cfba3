package com.valuationoracle.oracle.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a per-request traceId through reactive pipelines.
 *
 * <p>The Reactor Context holds the traceId; MDC is populated only around a single log call
 * via {@link #withMdc} and cleared right after.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY    = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /** Uses the caller's traceId when supplied, otherwise generates one. */
    public static String resolve(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return headerValue.trim();
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Never {@code null}; {@code "unknown"} when the pipeline was not tagged. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
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
