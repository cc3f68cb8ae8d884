package com.leaderboard.hosted.policy;

/**
 * Outcome of applying a leaderboard's update policy to one submission.
 */
public enum UpdateDecision {
    /** The candidate becomes current; the previous current entry is removed. */
    REPLACE,
    /** The candidate is dropped; the current entry stays. */
    RETAIN,
    /** The candidate is kept in history and becomes current. */
    APPEND_AS_CURRENT,
    /** The candidate is kept in history; the current entry stays. */
    APPEND;

    public boolean changesCurrent() {
        return this == REPLACE || this == APPEND_AS_CURRENT;
    }

    public boolean storesCandidate() {
        return this != RETAIN;
    }
}
