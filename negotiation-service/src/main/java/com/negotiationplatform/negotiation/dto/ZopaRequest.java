package com.negotiationplatform.negotiation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;

public record ZopaRequest(
    @JsonProperty("profileA") PartyProfile profileA,
    @JsonProperty("profileB") PartyProfile profileB,
    @JsonProperty("proposal") ProposedTerms proposal
) {}
