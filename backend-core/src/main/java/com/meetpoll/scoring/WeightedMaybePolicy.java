package com.meetpoll.scoring;

/**
 * {@code available + weight * maybe}; unavailable answers contribute nothing.
 */
public class WeightedMaybePolicy implements SlotScoringPolicy {

    private final double maybeWeight;

    public WeightedMaybePolicy(double maybeWeight) {
        if (maybeWeight < 0.0 || maybeWeight > 1.0) {
            throw new IllegalArgumentException("maybe weight must be within [0, 1]: " + maybeWeight);
        }
        this.maybeWeight = maybeWeight;
    }

    @Override
    public double score(int available, int maybe, int unavailable) {
        return available + maybeWeight * maybe;
    }

    public double getMaybeWeight() {
        return maybeWeight;
    }
}
