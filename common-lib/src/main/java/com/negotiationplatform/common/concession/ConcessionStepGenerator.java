package com.negotiationplatform.common.concession;

import com.negotiationplatform.common.model.ProposedTerms;

import java.util.Set;

/**
 * Produces one per-round concession: with probability equal to the concession rate,
 * drops the last tradable "get" of party A (and the aligned "give" of party B).
 * When the decider says no, the returned terms equal the input.
 *
 * <p>Stateless and thread-safe as long as the {@link ConcessionDecider} is.
 */
public class ConcessionStepGenerator {

    private final ConcessionDecider decider;

    public ConcessionStepGenerator(ConcessionDecider decider) {
        this.decider = decider;
    }

    public ProposedTerms step(ProposedTerms current, double rate, Set<String> redLines, int round) {
        double probability = Math.max(0.0, Math.min(1.0, rate));
        if (!ConcessionSteps.canConcede(current, redLines)) {
            return current;
        }
        if (!decider.shouldConcede(probability, round)) {
            return current;
        }
        return ConcessionSteps.concede(current, 1, redLines);
    }
}
