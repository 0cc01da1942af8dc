package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Something a party wants out of the deal.
 *
 * @param description unique item description, used as the item key in {@link ProposedTerms}
 * @param priority    importance of the need ({@code null} treated as {@link Priority#MEDIUM})
 * @param flexibility willingness to trade the need away, 0.0–1.0; {@code null} = not tradable
 */
public record Need(
    @JsonProperty("description") String description,
    @JsonProperty("priority")    Priority priority,
    @JsonProperty("flexibility") Double flexibility
) {
    public Need {
        if (priority == null) priority = Priority.MEDIUM;
    }

    public static Need of(String description, Priority priority, double flexibility) {
        return new Need(description, priority, flexibility);
    }

    @JsonIgnore
    public boolean isCritical() {
        return priority == Priority.CRITICAL;
    }
}
