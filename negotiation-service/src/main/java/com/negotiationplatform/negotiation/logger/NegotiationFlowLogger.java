package com.negotiationplatform.negotiation.logger;

import com.negotiationplatform.common.exception.InvalidNegotiationInputException;
import com.negotiationplatform.common.model.MoveDecision;
import com.negotiationplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of an engine request without touching the result.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED} : request decoded by the controller</li>
 *   <li>{@link #REQUEST_VALIDATED}: shape validation passed</li>
 *   <li>{@link #ENGINE_EVALUATED} : engine returned a result</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(NegotiationFlowLogger.ENGINE_EVALUATED, "move"))
 * </pre>
 */
@Component
public class NegotiationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(NegotiationFlowLogger.class);

    public static final String REQUEST_RECEIVED  = "REQUEST_RECEIVED";
    public static final String REQUEST_VALIDATED = "REQUEST_VALIDATED";
    public static final String ENGINE_EVALUATED  = "ENGINE_EVALUATED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext}.
     * Error and completion signals are ignored; failures go through {@link #logFailure}.
     */
    public <T> Consumer<Signal<T>> stage(String stageName, String operation) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[NegotiationFlow] stage={} operation={} traceId={}", stageName, operation, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String operation, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[NegotiationFlow] stage={} operation={} traceId={}", stageName, operation, traceId)
        );
    }

    /** Compact summary of a move decision, once per round. */
    public void logMove(MoveDecision decision, String strategy, int round, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[NegotiationFlow] move selected. strategy={} round={} action={} counterOffer={} traceId={}",
                     strategy, round, decision.action().tag(), decision.hasCounterOffer(), traceId)
        );
    }

    /** Validation rejections at WARN, anything else at ERROR with the stack trace. */
    public void logFailure(String operation, String traceId, Throwable error) {
        TraceContextUtil.withMdc(traceId, () -> {
            if (error instanceof InvalidNegotiationInputException) {
                log.warn("[NegotiationFlow] rejected operation={} reason={} traceId={}",
                         operation, error.getMessage(), traceId);
            } else {
                log.error("[NegotiationFlow] failed operation={} traceId={}", operation, traceId, error);
            }
        });
    }
}
