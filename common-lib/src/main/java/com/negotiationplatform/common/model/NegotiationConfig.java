package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-party negotiation settings, fixed for the lifetime of a session.
 *
 * @param style              declared style ({@code null} → {@link NegotiationStyle#BALANCED})
 * @param minAcceptableScore lowest proposal score the party accepts, 0.0–1.0
 *                           ({@code null} → {@value #DEFAULT_MIN_ACCEPTABLE})
 */
public record NegotiationConfig(
    @JsonProperty("style")              NegotiationStyle style,
    @JsonProperty("minAcceptableScore") Double minAcceptableScore
) {
    public static final double DEFAULT_MIN_ACCEPTABLE = 0.6;

    public NegotiationConfig {
        if (style == null) style = NegotiationStyle.BALANCED;
    }

    public static NegotiationConfig defaults() {
        return new NegotiationConfig(NegotiationStyle.BALANCED, DEFAULT_MIN_ACCEPTABLE);
    }

    public static NegotiationConfig of(NegotiationStyle style, double minAcceptableScore) {
        return new NegotiationConfig(style, minAcceptableScore);
    }

    /** Configured threshold, or the default when unset or zero. */
    public double effectiveMinAcceptable() {
        if (minAcceptableScore == null || minAcceptableScore == 0.0) {
            return DEFAULT_MIN_ACCEPTABLE;
        }
        return minAcceptableScore;
    }
}
