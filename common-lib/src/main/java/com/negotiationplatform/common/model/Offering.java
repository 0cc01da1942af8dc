package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Something a party can contribute to the deal.
 *
 * @param description unique item description
 * @param capacity    how much of it the party can provide, 0.0–1.0
 */
public record Offering(
    @JsonProperty("description") String description,
    @JsonProperty("capacity")    double capacity
) {
    public static Offering of(String description, double capacity) {
        return new Offering(description, capacity);
    }
}
