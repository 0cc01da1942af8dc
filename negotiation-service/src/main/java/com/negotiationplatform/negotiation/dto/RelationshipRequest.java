package com.negotiationplatform.negotiation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;

public record RelationshipRequest(
    @JsonProperty("profile")             PartyProfile profile,
    @JsonProperty("counterpartyProfile") PartyProfile counterpartyProfile,
    @JsonProperty("offer")               ProposedTerms offer,
    @JsonProperty("priorAgreements")     int priorAgreements
) {}
