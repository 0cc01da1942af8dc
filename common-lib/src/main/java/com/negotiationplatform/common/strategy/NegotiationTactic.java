package com.negotiationplatform.common.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param effectiveness expected payoff of the tactic, 0.0–1.0
 * @param riskLevel     chance of damaging the negotiation, 0.0–1.0
 */
public record NegotiationTactic(
    @JsonProperty("name")          String name,
    @JsonProperty("action")        String action,
    @JsonProperty("timing")        TacticTiming timing,
    @JsonProperty("effectiveness") double effectiveness,
    @JsonProperty("riskLevel")     double riskLevel
) {}
