package com.negotiationplatform.common.concession;

import com.negotiationplatform.common.model.ConcessionPlan;
import com.negotiationplatform.common.model.ConcessionStrategy;
import com.negotiationplatform.common.model.NegotiationConfig;
import com.negotiationplatform.common.model.NegotiationStyle;
import com.negotiationplatform.common.model.Need;
import com.negotiationplatform.common.model.Offering;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.Priority;
import com.negotiationplatform.common.model.ProposedTerms;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies red-line and tradable derivation, the fallback ladder and the
 * style-to-strategy table of {@link ConcessionPlanner}.
 */
class ConcessionPlannerTest {

    private static final List<Need> NEEDS = List.of(
        Need.of("Seed funding", Priority.CRITICAL, 0.1),
        Need.of("Office space", Priority.HIGH, 0.7),
        Need.of("Marketing support", Priority.MEDIUM, 0.5),
        new Need("Legal review", Priority.LOW, null),
        Need.of("Hiring help", Priority.LOW, 0.9));

    private static PartyProfile profile(NegotiationStyle style) {
        return PartyProfile.of("startup", NEEDS, List.of(Offering.of("Equity", 0.6)),
                               NegotiationConfig.of(style, 0.6));
    }

    private static ProposedTerms terms(String... gets) {
        return ProposedTerms.of(List.of("Equity"), List.of(gets), List.of(gets), List.of("Equity"));
    }

    // ── red lines and tradables ───────────────────────────────────────

    @Nested
    @DisplayName("red lines and tradables")
    class Classification {

        @Test
        @DisplayName("critical needs → red lines")
        void criticalNeedsAreRedLines() {
            ConcessionPlan plan = ConcessionPlanner.build(profile(NegotiationStyle.BALANCED), null, terms("a"));
            assertEquals(Set.of("Seed funding"), plan.redLines());
        }

        @Test
        @DisplayName("non-critical needs with flexibility > 0.5 → tradables; 0.5 and unset excluded")
        void flexibleNeedsAreTradable() {
            ConcessionPlan plan = ConcessionPlanner.build(profile(NegotiationStyle.BALANCED), null, terms("a"));
            assertEquals(Set.of("Office space", "Hiring help"), plan.tradables());
        }

        @Test
        @DisplayName("a description shared with a critical need never becomes tradable")
        void redLinesAndTradablesDisjoint() {
            PartyProfile profile = PartyProfile.of("p",
                List.of(Need.of("Funding", Priority.CRITICAL, 0.9), Need.of("Funding", Priority.LOW, 0.9)),
                List.of(), null);
            ConcessionPlan plan = ConcessionPlanner.build(profile, null, terms("Funding"));

            assertEquals(Set.of("Funding"), plan.redLines());
            assertTrue(plan.tradables().isEmpty());
        }

        @Test
        @DisplayName("profile without needs → empty sets, never fails")
        void emptyProfile() {
            ConcessionPlan plan = ConcessionPlanner.build(PartyProfile.of("p", null, null, null), null, null);
            assertTrue(plan.redLines().isEmpty());
            assertTrue(plan.tradables().isEmpty());
            assertEquals(ConcessionStrategy.GRADUAL, plan.strategy());
        }
    }

    // ── fallback ladder ───────────────────────────────────────────────

    @Nested
    @DisplayName("fallback ladder")
    class Ladder {

        @Test
        @DisplayName("five gets → three fallbacks shrinking by one exchange each")
        void threeShrinkingFallbacks() {
            ConcessionPlan plan = ConcessionPlanner.build(profile(NegotiationStyle.BALANCED), null,
                terms("g1", "g2", "g3", "g4", "g5"));

            assertEquals(3, plan.fallbackPositions().size());
            assertEquals(List.of("g1", "g2", "g3", "g4"), plan.fallbackPositions().get(0).partyAGets());
            assertEquals(List.of("g1", "g2", "g3"), plan.fallbackPositions().get(1).partyAGets());
            assertEquals(List.of("g1", "g2"), plan.fallbackPositions().get(2).partyAGets());
            assertEquals(List.of("g1", "g2", "g3", "g4"), plan.fallbackPositions().get(0).partyBGives());
            assertEquals(plan.fallbackPositions().get(0), plan.finalPosition());
        }

        @Test
        @DisplayName("two gets → every fallback keeps one get")
        void shortProposalFloorsAtOne() {
            ConcessionPlan plan = ConcessionPlanner.build(profile(NegotiationStyle.BALANCED), null,
                terms("g1", "g2"));
            plan.fallbackPositions().forEach(f -> assertEquals(List.of("g1"), f.partyAGets()));
        }

        @Test
        @DisplayName("red line at the tail survives every fallback")
        void redLineNeverConceded() {
            ConcessionPlan plan = ConcessionPlanner.build(profile(NegotiationStyle.BALANCED), null,
                terms("g1", "g2", "Seed funding"));

            assertEquals(List.of("g1", "Seed funding"), plan.fallbackPositions().get(0).partyAGets());
            assertEquals(List.of("Seed funding"), plan.fallbackPositions().get(1).partyAGets());
            plan.fallbackPositions().forEach(f -> assertTrue(f.partyAGets().contains("Seed funding")));
        }

        @Test
        @DisplayName("absent proposal → empty initial position and empty fallbacks")
        void absentProposal() {
            ConcessionPlan plan = ConcessionPlanner.build(profile(NegotiationStyle.BALANCED), null, null);
            assertTrue(plan.initialPosition().partyAGets().isEmpty());
            plan.fallbackPositions().forEach(f -> assertTrue(f.partyAGets().isEmpty()));
        }
    }

    // ── strategy table ────────────────────────────────────────────────

    @ParameterizedTest(name = "{0} → {1} @ {2}")
    @CsvSource({
        "COMPETITIVE,   FIRM,        0.05",
        "COLLABORATIVE, TIT_FOR_TAT, 0.15",
        "ACCOMMODATING, FLEXIBLE,    0.25",
        "COMPROMISING,  GRADUAL,     0.12",
        "BALANCED,      GRADUAL,     0.12"
    })
    @DisplayName("style → strategy and rate")
    void styleTable(NegotiationStyle style, ConcessionStrategy strategy, double rate) {
        ConcessionPlan plan = ConcessionPlanner.build(profile(style), null, terms("a"));
        assertEquals(strategy, plan.strategy());
        assertEquals(rate, plan.concessionRate());
    }
}
