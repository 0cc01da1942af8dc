package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * A party's declared negotiating temperament. Drives the concession strategy
 * and rate chosen by the concession planner.
 *
 * <p>{@link #BALANCED} doubles as the adaptive style and as the fallback for
 * anything unrecognised.
 */
public enum NegotiationStyle {
    COMPETITIVE,
    COLLABORATIVE,
    COMPROMISING,
    ACCOMMODATING,
    BALANCED;

    /**
     * Lenient parse of a style name. Accepts any case and the {@code ADAPTIVE} alias.
     * Unknown, blank or {@code null} names resolve to {@link #BALANCED}; never throws.
     * Also used by Jackson to decode {@code config.style}.
     */
    @JsonCreator
    public static NegotiationStyle fromName(String name) {
        if (name == null || name.isBlank()) return BALANCED;
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("ADAPTIVE".equals(normalized)) return BALANCED;
        for (NegotiationStyle style : values()) {
            if (style.name().equals(normalized)) return style;
        }
        return BALANCED;
    }
}
