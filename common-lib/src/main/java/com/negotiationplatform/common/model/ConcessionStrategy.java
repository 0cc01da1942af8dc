package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Concession behaviour derived from a {@link NegotiationStyle}.
 *
 * <pre>
 *   COMPETITIVE                         → FIRM         0.05
 *   COLLABORATIVE                       → TIT_FOR_TAT  0.15
 *   ACCOMMODATING                       → FLEXIBLE     0.25
 *   COMPROMISING / BALANCED / unknown   → GRADUAL      0.12
 * </pre>
 */
public enum ConcessionStrategy {
    TIT_FOR_TAT("tit-for-tat", 0.15),
    GRADUAL("gradual", 0.12),
    FIRM("firm", 0.05),
    FLEXIBLE("flexible", 0.25);

    private final String tag;
    private final double defaultRate;

    ConcessionStrategy(String tag, double defaultRate) {
        this.tag = tag;
        this.defaultRate = defaultRate;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public double defaultRate() {
        return defaultRate;
    }

    public static ConcessionStrategy forStyle(NegotiationStyle style) {
        if (style == null) return GRADUAL;
        return switch (style) {
            case COMPETITIVE   -> FIRM;
            case COLLABORATIVE -> TIT_FOR_TAT;
            case ACCOMMODATING -> FLEXIBLE;
            default            -> GRADUAL;
        };
    }
}
