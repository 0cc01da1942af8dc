package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One round's output from the move selector. Transient; persisting it is the
 * session orchestrator's job.
 *
 * @param counterOffer terms to send back, or {@code null} when the action carries none
 */
public record MoveDecision(
    @JsonProperty("action")       MoveAction action,
    @JsonProperty("reasoning")    String reasoning,
    @JsonProperty("counterOffer") ProposedTerms counterOffer
) {
    public static MoveDecision of(MoveAction action, String reasoning) {
        return new MoveDecision(action, reasoning, null);
    }

    public static MoveDecision withOffer(MoveAction action, String reasoning, ProposedTerms counterOffer) {
        return new MoveDecision(action, reasoning, counterOffer);
    }

    public boolean hasCounterOffer() {
        return counterOffer != null;
    }
}
