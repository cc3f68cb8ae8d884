package com.leaderboard.hosted.exception;

/**
 * The rank index and the score store disagree about a leaderboard's current
 * entries. Raised internally and resolved by rebuilding the index.
 */
public class IndexInconsistencyException extends LeaderboardException {
    public IndexInconsistencyException(String message) {
        super(message, "INDEX_INCONSISTENCY");
    }
}
