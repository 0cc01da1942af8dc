package com.negotiationplatform.negotiation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;

public record ConcessionPlanRequest(
    @JsonProperty("profile")             PartyProfile profile,
    @JsonProperty("counterpartyProfile") PartyProfile counterpartyProfile,
    @JsonProperty("initialProposal")     ProposedTerms initialProposal
) {}
