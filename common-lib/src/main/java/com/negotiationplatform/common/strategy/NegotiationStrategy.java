package com.negotiationplatform.common.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** A named negotiation playbook: when to use it, what to expect, and its tactics. */
public record NegotiationStrategy(
    @JsonProperty("name")            String name,
    @JsonProperty("description")     String description,
    @JsonProperty("tactics")         List<NegotiationTactic> tactics,
    @JsonProperty("whenToUse")       String whenToUse,
    @JsonProperty("expectedOutcome") String expectedOutcome
) {
    public NegotiationStrategy {
        tactics = tactics == null ? List.of() : List.copyOf(tactics);
    }
}
