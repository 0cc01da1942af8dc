package com.negotiationplatform.common.concession;

import java.util.SplittableRandom;

/**
 * {@link ConcessionDecider} that draws a uniform number from a generator seeded by
 * {@code (seed, round)} and concedes when the draw falls below the probability.
 *
 * <p>No generator state survives between calls: the same seed and round always
 * produce the same draw, whichever session or thread asks.
 */
public final class RoundSeededConcessionDecider implements ConcessionDecider {

    private final long seed;

    public RoundSeededConcessionDecider(long seed) {
        this.seed = seed;
    }

    @Override
    public boolean shouldConcede(double probability, int round) {
        return draw(round) < probability;
    }

    double draw(int round) {
        return new SplittableRandom(seed * 31L + round).nextDouble();
    }

    public long seed() {
        return seed;
    }
}
