package com.negotiationplatform.negotiation.controller;

import com.negotiationplatform.common.concession.ConcessionPlanner;
import com.negotiationplatform.common.model.ConcessionPlan;
import com.negotiationplatform.negotiation.config.NegotiationEngineConfig;
import com.negotiationplatform.negotiation.dto.BatnaRequest;
import com.negotiationplatform.negotiation.dto.ConcessionPlanRequest;
import com.negotiationplatform.negotiation.dto.MoveRequest;
import com.negotiationplatform.negotiation.dto.RelationshipRequest;
import com.negotiationplatform.negotiation.dto.StrategyRequest;
import com.negotiationplatform.negotiation.dto.ZopaRequest;
import com.negotiationplatform.negotiation.logger.NegotiationFlowLogger;
import com.negotiationplatform.negotiation.service.NegotiationEngineService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static com.negotiationplatform.negotiation.NegotiationFixtures.INVESTOR;
import static com.negotiationplatform.negotiation.NegotiationFixtures.OPENING;
import static com.negotiationplatform.negotiation.NegotiationFixtures.STARTUP;
import static org.hamcrest.Matchers.closeTo;

@WebFluxTest(NegotiationController.class)
@Import({NegotiationEngineConfig.class, NegotiationEngineService.class, NegotiationFlowLogger.class})
class NegotiationControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    private WebTestClient.ResponseSpec post(String path, Object body) {
        return webTestClient.post().uri("/api/v1/negotiation" + path)
            .contentType(MediaType.APPLICATION_JSON)
            .header(NegotiationController.TRACE_HEADER, "trace-test")
            .bodyValue(body)
            .exchange();
    }

    // ── analysis endpoints ───────────────────────────────────────────

    @Test
    @DisplayName("POST /batna returns 200 with availability")
    void batna() {
        post("/batna", new BatnaRequest(STARTUP, INVESTOR))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.value").isEqualTo(0.7)
            .jsonPath("$.alternative").isEqualTo("Pursue other partnership opportunities");
    }

    @Test
    @DisplayName("POST /zopa returns 200 with bounds")
    void zopa() {
        post("/zopa", new ZopaRequest(STARTUP, INVESTOR, OPENING))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.exists").isEqualTo(true)
            .jsonPath("$.lowerBound").isEqualTo(0.6);
    }

    @Test
    @DisplayName("POST /concession-plan returns strategy as its wire tag")
    void concessionPlan() {
        post("/concession-plan", new ConcessionPlanRequest(STARTUP, INVESTOR, OPENING))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.strategy").isEqualTo("firm")
            .jsonPath("$.concessionRate").isEqualTo(0.05)
            .jsonPath("$.fallbackPositions.length()").isEqualTo(3);
    }

    @Test
    @DisplayName("POST /relationship returns 200")
    void relationship() {
        post("/relationship", new RelationshipRequest(STARTUP, INVESTOR, OPENING, 2))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.prioritizeRelationship").isEqualTo(false)
            .jsonPath("$.relationshipValue").value(closeTo(0.7, 1e-9));
    }

    @Test
    @DisplayName("POST /strategy returns the competitive playbook")
    void strategy() {
        post("/strategy", new StrategyRequest(STARTUP, INVESTOR, 1))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.name").isEqualTo("Competitive/Win-Lose")
            .jsonPath("$.tactics.length()").isEqualTo(3);
    }

    // ── decoding ─────────────────────────────────────────────────────

    private static String planRequestWithStyle(String style) {
        return """
            {
              "profile": {
                "partyId": "startup",
                "needs": [{"description": "Seed funding", "priority": "CRITICAL", "flexibility": 0.1}],
                "offerings": [{"description": "Equity", "capacity": 0.6}],
                "config": {"style": "%s", "minAcceptableScore": 0.6}
              },
              "initialProposal": {
                "partyAGives": ["Equity"],
                "partyAGets": ["Seed funding", "Office space"],
                "partyBGives": ["Seed funding", "Office space"],
                "partyBGets": ["Equity"]
              }
            }
            """.formatted(style);
    }

    private WebTestClient.ResponseSpec postJson(String path, String json) {
        return webTestClient.post().uri("/api/v1/negotiation" + path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(json)
            .exchange();
    }

    @Test
    @DisplayName("style ADAPTIVE → balanced, gradual plan at 0.12")
    void adaptiveStyle() {
        postJson("/concession-plan", planRequestWithStyle("ADAPTIVE"))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.strategy").isEqualTo("gradual")
            .jsonPath("$.concessionRate").isEqualTo(0.12);
    }

    @Test
    @DisplayName("unknown style → balanced, gradual plan at 0.12")
    void unknownStyle() {
        postJson("/concession-plan", planRequestWithStyle("ruthless"))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.strategy").isEqualTo("gradual")
            .jsonPath("$.concessionRate").isEqualTo(0.12);
    }

    @Test
    @DisplayName("lower-case style name → parsed case-insensitively")
    void lowerCaseStyle() {
        postJson("/concession-plan", planRequestWithStyle("competitive"))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.strategy").isEqualTo("firm");
    }

    @Test
    @DisplayName("unknown request fields are ignored")
    void unknownFieldsIgnored() {
        String json = planRequestWithStyle("COLLABORATIVE")
            .replaceFirst("\\{", "{\"sessionId\": \"s-1\", ");

        postJson("/concession-plan", json)
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.strategy").isEqualTo("tit-for-tat");
    }

    // ── move endpoint ────────────────────────────────────────────────

    @Test
    @DisplayName("POST /move returns the action as its wire tag")
    void move() {
        ConcessionPlan plan = ConcessionPlanner.build(STARTUP, INVESTOR, OPENING);

        post("/move", new MoveRequest(STARTUP, INVESTOR, OPENING, OPENING, plan, 2))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.action").isEqualTo("accept")
            .jsonPath("$.reasoning").isEqualTo("Within ZOPA and meets minimum threshold");
    }

    @Test
    @DisplayName("POST /move with round 0 returns 400 naming the field")
    void moveRoundZero() {
        ConcessionPlan plan = ConcessionPlanner.build(STARTUP, INVESTOR, OPENING);

        post("/move", new MoveRequest(STARTUP, INVESTOR, OPENING, null, plan, 0))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("[round] must be >= 1 but was 0");
    }

    @Test
    @DisplayName("GET /health returns OK")
    void health() {
        webTestClient.get().uri("/api/v1/negotiation/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
