package com.safetyrisk.riskservice.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the request trace id through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the trace id. MDC is only written
 * as a temporary bridge while a log statement runs, never as a persistent ThreadLocal store,
 * because engine work hops onto {@code boundedElastic} threads.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /** Uses the caller's trace id when it sent one, otherwise mints a new one. */
    public static String resolveTraceId(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return headerValue.trim();
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. {@code contextWrite}
     * propagates upstream during subscription, so call this last when assembling.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Returns {@code "unknown"} when absent, never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
