package com.negotiationplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("NegotiationStyle.fromName()")
    class StyleParsing {

        @Test
        @DisplayName("case-insensitive names parse")
        void parses() {
            assertEquals(NegotiationStyle.COMPETITIVE, NegotiationStyle.fromName("competitive"));
            assertEquals(NegotiationStyle.ACCOMMODATING, NegotiationStyle.fromName(" Accommodating "));
        }

        @Test
        @DisplayName("adaptive, unknown, blank and null → BALANCED")
        void fallsBackToBalanced() {
            assertEquals(NegotiationStyle.BALANCED, NegotiationStyle.fromName("adaptive"));
            assertEquals(NegotiationStyle.BALANCED, NegotiationStyle.fromName("ruthless"));
            assertEquals(NegotiationStyle.BALANCED, NegotiationStyle.fromName(" "));
            assertEquals(NegotiationStyle.BALANCED, NegotiationStyle.fromName(null));
        }
    }

    @Nested
    @DisplayName("NegotiationConfig")
    class Config {

        @Test
        @DisplayName("unset or zero minimum → 0.6")
        void effectiveMinimum() {
            assertEquals(0.6, new NegotiationConfig(NegotiationStyle.BALANCED, null).effectiveMinAcceptable());
            assertEquals(0.6, NegotiationConfig.of(NegotiationStyle.BALANCED, 0.0).effectiveMinAcceptable());
            assertEquals(0.75, NegotiationConfig.of(NegotiationStyle.BALANCED, 0.75).effectiveMinAcceptable());
        }
    }

    @Nested
    @DisplayName("PartyProfile / ProposedTerms")
    class Snapshots {

        @Test
        @DisplayName("caller-side list mutation is not observed")
        void defensiveCopies() {
            List<String> gets = new ArrayList<>(List.of("Funding"));
            ProposedTerms terms = ProposedTerms.of(List.of(), gets, List.of(), List.of());
            gets.add("Office space");

            assertEquals(List.of("Funding"), terms.partyAGets());
            assertThrows(UnsupportedOperationException.class, () -> terms.partyAGets().add("x"));
        }

        @Test
        @DisplayName("null collections and config → empty lists and defaults")
        void nullsNormalized() {
            PartyProfile profile = new PartyProfile("p", null, null, null);
            assertTrue(profile.needs().isEmpty());
            assertTrue(profile.offerings().isEmpty());
            assertEquals(NegotiationStyle.BALANCED, profile.style());
        }

        @Test
        @DisplayName("net position = gets − gives")
        void netPosition() {
            ProposedTerms terms = ProposedTerms.of(List.of("a"), List.of("x", "y", "z"), List.of(), List.of());
            assertEquals(2, terms.netPositionA());
        }

        @Test
        @DisplayName("strategy wire tags")
        void wireTags() {
            assertEquals("tit-for-tat", ConcessionStrategy.TIT_FOR_TAT.tag());
            assertEquals("hold_firm", MoveAction.HOLD_FIRM.tag());
            assertEquals(ConcessionStrategy.FIRM, ConcessionStrategy.forStyle(NegotiationStyle.COMPETITIVE));
            assertEquals(ConcessionStrategy.GRADUAL, ConcessionStrategy.forStyle(null));
        }
    }
}
