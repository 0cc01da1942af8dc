package com.negotiationplatform.negotiation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.negotiationplatform.common.model.ConcessionPlan;
import com.negotiationplatform.common.model.PartyProfile;
import com.negotiationplatform.common.model.ProposedTerms;

/**
 * One round of context for the move selector.
 *
 * @param opponentLastProposal {@code null} in the opening round
 */
public record MoveRequest(
    @JsonProperty("profile")              PartyProfile profile,
    @JsonProperty("counterpartyProfile")  PartyProfile counterpartyProfile,
    @JsonProperty("currentProposal")      ProposedTerms currentProposal,
    @JsonProperty("opponentLastProposal") ProposedTerms opponentLastProposal,
    @JsonProperty("plan")                 ConcessionPlan plan,
    @JsonProperty("round")                int round
) {}
