package com.negotiationplatform.negotiation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.negotiationplatform.common.model.PartyProfile;

public record StrategyRequest(
    @JsonProperty("profile")             PartyProfile profile,
    @JsonProperty("counterpartyProfile") PartyProfile counterpartyProfile,
    @JsonProperty("round")               int round
) {}
