package com.negotiationplatform.negotiation.service;

import com.negotiationplatform.common.engine.NegotiationEngine;
import com.negotiationplatform.common.model.Batna;
import com.negotiationplatform.common.model.ConcessionPlan;
import com.negotiationplatform.common.model.MoveDecision;
import com.negotiationplatform.common.model.RelationshipDecision;
import com.negotiationplatform.common.model.Zopa;
import com.negotiationplatform.common.strategy.NegotiationStrategy;
import com.negotiationplatform.common.trace.TraceContextUtil;
import com.negotiationplatform.negotiation.dto.BatnaRequest;
import com.negotiationplatform.negotiation.dto.ConcessionPlanRequest;
import com.negotiationplatform.negotiation.dto.MoveRequest;
import com.negotiationplatform.negotiation.dto.RelationshipRequest;
import com.negotiationplatform.negotiation.dto.StrategyRequest;
import com.negotiationplatform.negotiation.dto.ZopaRequest;
import com.negotiationplatform.negotiation.logger.NegotiationFlowLogger;
import com.negotiationplatform.negotiation.validation.NegotiationRequestValidator;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Reactive wrapper around {@link NegotiationEngine}: validates each request, runs the
 * engine and logs the lifecycle under the caller's traceId.
 *
 * <p>The engine is pure CPU work with no I/O, so evaluation runs on the subscribing thread.
 */
@Service
public class NegotiationEngineService {

    private final NegotiationEngine engine;
    private final NegotiationFlowLogger flowLogger;

    public NegotiationEngineService(NegotiationEngine engine, NegotiationFlowLogger flowLogger) {
        this.engine     = engine;
        this.flowLogger = flowLogger;
    }

    public Mono<Batna> estimateBatna(BatnaRequest request, String traceId) {
        return evaluate("batna", TraceContextUtil.resolveTraceId(traceId),
            () -> NegotiationRequestValidator.validate(request),
            () -> engine.estimateBatna(request.profile(), request.counterpartyProfile()));
    }

    public Mono<Zopa> computeZopa(ZopaRequest request, String traceId) {
        return evaluate("zopa", TraceContextUtil.resolveTraceId(traceId),
            () -> NegotiationRequestValidator.validate(request),
            () -> engine.computeZopa(request.profileA(), request.profileB(), request.proposal()));
    }

    public Mono<ConcessionPlan> buildConcessionPlan(ConcessionPlanRequest request, String traceId) {
        return evaluate("concession-plan", TraceContextUtil.resolveTraceId(traceId),
            () -> NegotiationRequestValidator.validate(request),
            () -> engine.buildConcessionPlan(request.profile(), request.counterpartyProfile(),
                                             request.initialProposal()));
    }

    public Mono<MoveDecision> selectMove(MoveRequest request, String traceId) {
        String resolvedTraceId = TraceContextUtil.resolveTraceId(traceId);
        return evaluate("move", resolvedTraceId,
            () -> NegotiationRequestValidator.validate(request),
            () -> engine.selectMove(request.profile(), request.counterpartyProfile(),
                                    request.currentProposal(), request.opponentLastProposal(),
                                    request.plan(), request.round()))
            .doOnNext(decision -> flowLogger.logMove(decision, request.plan().strategy().tag(),
                                                     request.round(), resolvedTraceId));
    }

    public Mono<RelationshipDecision> optimizeForRelationship(RelationshipRequest request, String traceId) {
        return evaluate("relationship", TraceContextUtil.resolveTraceId(traceId),
            () -> NegotiationRequestValidator.validate(request),
            () -> engine.optimizeForRelationship(request.profile(), request.counterpartyProfile(),
                                                 request.offer(), request.priorAgreements()));
    }

    public Mono<NegotiationStrategy> developStrategy(StrategyRequest request, String traceId) {
        return evaluate("strategy", TraceContextUtil.resolveTraceId(traceId),
            () -> NegotiationRequestValidator.validate(request),
            () -> engine.developStrategy(request.profile(), request.counterpartyProfile(), request.round()));
    }

    /** {@code traceId} must already be resolved; every stage logs once per subscription. */
    private <T> Mono<T> evaluate(String operation, String traceId,
                                 Runnable validation, Supplier<T> evaluation) {
        Mono<T> pipeline = Mono.defer(() -> {
                flowLogger.logWithTraceId(NegotiationFlowLogger.REQUEST_RECEIVED, operation, traceId);
                return Mono.fromCallable(() -> {
                    validation.run();
                    return operation;
                });
            })
            .doOnEach(flowLogger.stage(NegotiationFlowLogger.REQUEST_VALIDATED, operation))
            .map(validated -> evaluation.get())
            .doOnEach(flowLogger.stage(NegotiationFlowLogger.ENGINE_EVALUATED, operation))
            .doOnError(e -> flowLogger.logFailure(operation, traceId, e));

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }
}
