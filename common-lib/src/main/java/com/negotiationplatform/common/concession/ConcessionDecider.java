package com.negotiationplatform.common.concession;

/**
 * Decides whether a probabilistic concession step actually happens.
 *
 * <p>Implementations must be deterministic for a given {@code (probability, round)}
 * pair so that a recorded round can be re-derived later, and must be safe to
 * share across concurrently running sessions.
 *
 * <p>Current implementations: {@link RoundSeededConcessionDecider},
 * {@link ThresholdConcessionDecider}.
 */
@FunctionalInterface
public interface ConcessionDecider {

    /**
     * @param probability concession probability; callers pass values already clamped to [0.0, 1.0]
     * @param round       current negotiation round (≥ 1)
     * @return {@code true} if the concession should be made this round
     */
    boolean shouldConcede(double probability, int round);
}
