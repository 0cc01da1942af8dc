package com.negotiationplatform.common.concession;

/**
 * Deterministic {@link ConcessionDecider}: concede iff {@code probability >= threshold}.
 * A threshold of 0.0 always concedes; a threshold above 1.0 never does.
 */
public final class ThresholdConcessionDecider implements ConcessionDecider {

    private final double threshold;

    public ThresholdConcessionDecider(double threshold) {
        this.threshold = threshold;
    }

    public static ThresholdConcessionDecider always() {
        return new ThresholdConcessionDecider(0.0);
    }

    public static ThresholdConcessionDecider never() {
        return new ThresholdConcessionDecider(Double.POSITIVE_INFINITY);
    }

    @Override
    public boolean shouldConcede(double probability, int round) {
        return probability >= threshold;
    }
}
