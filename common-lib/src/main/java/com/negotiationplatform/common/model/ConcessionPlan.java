package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * A party's pre-computed plan for the session.
 *
 * @param initialPosition   opening terms
 * @param fallbackPositions successively more conceded terms (index 0 = smallest concession)
 * @param redLines          item descriptions that must never be conceded
 * @param tradables         item descriptions the party will exchange; disjoint from {@code redLines}
 * @param concessionRate    per-round concession probability, in (0, 1]
 * @param strategy          concession strategy that drives the move selector
 */
public record ConcessionPlan(
    @JsonProperty("initialPosition")   ProposedTerms initialPosition,
    @JsonProperty("fallbackPositions") List<ProposedTerms> fallbackPositions,
    @JsonProperty("redLines")          Set<String> redLines,
    @JsonProperty("tradables")         Set<String> tradables,
    @JsonProperty("concessionRate")    double concessionRate,
    @JsonProperty("strategy")          ConcessionStrategy strategy
) {
    public ConcessionPlan {
        fallbackPositions = fallbackPositions == null ? List.of() : List.copyOf(fallbackPositions);
        redLines          = redLines == null ? Set.of() : Set.copyOf(redLines);
        tradables         = tradables == null ? Set.of() : Set.copyOf(tradables);
        if (strategy == null) strategy = ConcessionStrategy.GRADUAL;
    }

    /** First fallback, or the initial position when the ladder is empty. */
    public ProposedTerms finalPosition() {
        return fallbackPositions.isEmpty() ? initialPosition : fallbackPositions.get(0);
    }
}
