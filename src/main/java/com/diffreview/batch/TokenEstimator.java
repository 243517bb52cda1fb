package com.diffreview.batch;

/**
 * Coarse cost of sending text to the generation backend. Implementations must be deterministic and must not
 * return a smaller value for a longer text.
 */
public interface TokenEstimator {
    int estimate(String text);

    default String name() {
        return getClass().getSimpleName();
    }
}
