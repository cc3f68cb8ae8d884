package com.leaderboard.hosted.model;

/**
 * Whether higher or lower score values rank first on a leaderboard.
 */
public enum ScoreOrdering {
    HIGHER_IS_BETTER,
    LOWER_IS_BETTER;

    /**
     * Compares two score values so that the better one sorts first.
     * Returns a negative number when {@code a} is better than {@code b}.
     */
    public int compareValues(double a, double b) {
        return this == HIGHER_IS_BETTER ? Double.compare(b, a) : Double.compare(a, b);
    }

    public boolean isStrictlyBetter(double candidate, double current) {
        return compareValues(candidate, current) < 0;
    }
}
