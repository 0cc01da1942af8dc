package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Best Alternative To a Negotiated Agreement: what a party falls back to if no deal closes.
 *
 * @param alternative  short label of the fallback course of action
 * @param value        how good the alternative is, 0.0–1.0
 * @param availability how likely the alternative is actually available, 0.0–1.0
 * @param description  human-readable justification
 */
public record Batna(
    @JsonProperty("alternative")  String alternative,
    @JsonProperty("value")        double value,
    @JsonProperty("availability") double availability,
    @JsonProperty("description")  String description
) {}
