package com.negotiationplatform.common.strategy;

/**
 * Phase of the negotiation in which a tactic is meant to be used.
 *
 * <ul>
 *   <li>{@link #EARLY} : rounds 1–3</li>
 *   <li>{@link #MIDDLE}: rounds 4–7</li>
 *   <li>{@link #LATE}  : round 8 onward</li>
 *   <li>{@link #ANY}   : every round</li>
 * </ul>
 */
public enum TacticTiming {
    EARLY,
    MIDDLE,
    LATE,
    ANY;

    public static TacticTiming forRound(int round) {
        if (round <= 3) return EARLY;
        if (round <= 7) return MIDDLE;
        return LATE;
    }

    public boolean appliesTo(int round) {
        return this == ANY || this == forRound(round);
    }
}
