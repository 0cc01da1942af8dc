package com.negotiationplatform.negotiation.controller;

import com.negotiationplatform.common.exception.InvalidNegotiationInputException;
import com.negotiationplatform.negotiation.dto.BatnaRequest;
import com.negotiationplatform.negotiation.dto.ConcessionPlanRequest;
import com.negotiationplatform.negotiation.dto.MoveRequest;
import com.negotiationplatform.negotiation.dto.RelationshipRequest;
import com.negotiationplatform.negotiation.dto.StrategyRequest;
import com.negotiationplatform.negotiation.dto.ZopaRequest;
import com.negotiationplatform.negotiation.service.NegotiationEngineService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/negotiation")
public class NegotiationController {

    static final String TRACE_HEADER = "X-Trace-Id";

    private final NegotiationEngineService engineService;

    public NegotiationController(NegotiationEngineService engineService) {
        this.engineService = engineService;
    }

    @PostMapping("/batna")
    public Mono<ResponseEntity<Object>> batna(
            @RequestBody BatnaRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return respond(engineService.estimateBatna(request, traceId));
    }

    @PostMapping("/zopa")
    public Mono<ResponseEntity<Object>> zopa(
            @RequestBody ZopaRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return respond(engineService.computeZopa(request, traceId));
    }

    @PostMapping("/concession-plan")
    public Mono<ResponseEntity<Object>> concessionPlan(
            @RequestBody ConcessionPlanRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return respond(engineService.buildConcessionPlan(request, traceId));
    }

    @PostMapping("/move")
    public Mono<ResponseEntity<Object>> move(
            @RequestBody MoveRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return respond(engineService.selectMove(request, traceId));
    }

    @PostMapping("/relationship")
    public Mono<ResponseEntity<Object>> relationship(
            @RequestBody RelationshipRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return respond(engineService.optimizeForRelationship(request, traceId));
    }

    @PostMapping("/strategy")
    public Mono<ResponseEntity<Object>> strategy(
            @RequestBody StrategyRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceId) {
        return respond(engineService.developStrategy(request, traceId));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private <T> Mono<ResponseEntity<Object>> respond(Mono<T> result) {
        return result
            .map(body -> ResponseEntity.<Object>ok(body))
            .onErrorResume(InvalidNegotiationInputException.class, e ->
                Mono.just(ResponseEntity.badRequest().<Object>body(Map.of("error", e.getMessage()))));
    }
}
