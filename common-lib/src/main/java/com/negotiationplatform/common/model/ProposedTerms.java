package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of a deal on the table. Party A is always the acting party
 * (the profile passed first to the engine); party B is the counterparty.
 *
 * <p>Every modification returns a new instance. {@code partyAGets[i]} and
 * {@code partyBGives[i]} describe the same exchanged item and are removed together.
 */
public record ProposedTerms(
    @JsonProperty("partyAGives") List<String> partyAGives,
    @JsonProperty("partyAGets")  List<String> partyAGets,
    @JsonProperty("partyBGives") List<String> partyBGives,
    @JsonProperty("partyBGets")  List<String> partyBGets
) {
    public ProposedTerms {
        partyAGives = partyAGives == null ? List.of() : List.copyOf(partyAGives);
        partyAGets  = partyAGets  == null ? List.of() : List.copyOf(partyAGets);
        partyBGives = partyBGives == null ? List.of() : List.copyOf(partyBGives);
        partyBGets  = partyBGets  == null ? List.of() : List.copyOf(partyBGets);
    }

    public static ProposedTerms of(List<String> partyAGives, List<String> partyAGets,
                                   List<String> partyBGives, List<String> partyBGets) {
        return new ProposedTerms(partyAGives, partyAGets, partyBGives, partyBGets);
    }

    /** Party A's net position: items received minus items given. */
    public int netPositionA() {
        return partyAGets.size() - partyAGives.size();
    }

    /**
     * Returns a copy with the "get" at {@code index} removed from party A, and the
     * index-aligned "give" removed from party B when one exists.
     */
    public ProposedTerms withoutExchangeAt(int index) {
        List<String> aGets = new ArrayList<>(partyAGets);
        aGets.remove(index);
        List<String> bGives = new ArrayList<>(partyBGives);
        if (index < bGives.size()) {
            bGives.remove(index);
        }
        return new ProposedTerms(partyAGives, aGets, bGives, partyBGets);
    }

    /** Returns a copy where party A additionally gives {@code item} and party B receives it. */
    public ProposedTerms withAdditionalOffering(String item) {
        List<String> aGives = new ArrayList<>(partyAGives);
        aGives.add(item);
        List<String> bGets = new ArrayList<>(partyBGets);
        bGets.add(item);
        return new ProposedTerms(aGives, partyAGets, partyBGives, bGets);
    }
}
