package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Zone Of Possible Agreement between two parties for one proposal.
 *
 * <p>Invariants: {@code exists == (upperBound >= lowerBound)} and
 * {@code range == max(0, upperBound - lowerBound)}.
 */
public record Zopa(
    @JsonProperty("exists")         boolean exists,
    @JsonProperty("lowerBound")     double lowerBound,
    @JsonProperty("upperBound")     double upperBound,
    @JsonProperty("midpoint")       double midpoint,
    @JsonProperty("range")          double range,
    @JsonProperty("recommendation") String recommendation
) {}
