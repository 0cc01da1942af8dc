package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of the relationship-vs-transaction comparison.
 *
 * @param adjustedOffer enriched offer when the relationship is prioritised, otherwise {@code null}
 */
public record RelationshipDecision(
    @JsonProperty("prioritizeRelationship") boolean prioritizeRelationship,
    @JsonProperty("relationshipValue")      double relationshipValue,
    @JsonProperty("transactionValue")       double transactionValue,
    @JsonProperty("adjustedOffer")          ProposedTerms adjustedOffer,
    @JsonProperty("reasoning")              String reasoning
) {}
