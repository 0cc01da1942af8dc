package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only view of one negotiating party: what it needs, what it can offer,
 * and how it negotiates. Lists are copied on construction so the engine never
 * observes caller mutations.
 */
public record PartyProfile(
    @JsonProperty("partyId")   String partyId,
    @JsonProperty("needs")     List<Need> needs,
    @JsonProperty("offerings") List<Offering> offerings,
    @JsonProperty("config")    NegotiationConfig config
) {
    public PartyProfile {
        needs     = needs == null ? List.of() : List.copyOf(needs);
        offerings = offerings == null ? List.of() : List.copyOf(offerings);
        if (config == null) config = NegotiationConfig.defaults();
    }

    public static PartyProfile of(String partyId, List<Need> needs, List<Offering> offerings,
                                  NegotiationConfig config) {
        return new PartyProfile(partyId, needs, offerings, config);
    }

    public NegotiationStyle style() {
        return config.style();
    }

    public long criticalNeedCount() {
        return needs.stream().filter(Need::isCritical).count();
    }
}
