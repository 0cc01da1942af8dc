package com.negotiationplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Lightweight reactive tracing utility.
 *
 * <p>Reactor Context is the single source of truth for traceId inside reactive pipelines.
 * MDC is only ever written as a temporary bridge during a log statement, never as a
 * persistent ThreadLocal store.
 *
 * <p>Usage pattern in reactive chains:
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly; {@code contextWrite} propagates upstream during subscription.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Returns the traceId in {@code ctx}, or {@code "unknown"}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Caller-supplied traceId when present, otherwise a new random one. */
    public static String resolveTraceId(String candidate) {
        return (candidate == null || candidate.isBlank()) ? UUID.randomUUID().toString() : candidate;
    }

    /**
     * Temporarily bridges {@code traceId} into MDC for the duration of {@code logAction},
     * then removes the entry. Only for logging side-effects.
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
