package com.leaderboard.hosted.model;

/**
 * How a new submission interacts with a player's existing entries.
 */
public enum UpdatePolicy {
    /** Keep only the best entry ever submitted. */
    KEEP_BEST,
    /** Keep only the most recent submission. */
    KEEP_LATEST,
    /** Retain every submission; the best one counts toward the rank. */
    KEEP_ALL
}
