package com.leaderboard.hosted.service;

/**
 * Lifecycle of one score submission. A submission that fails before
 * {@link #PERSISTING} leaves no trace; from {@code PERSISTING} on it runs to
 * completion even if its caller gives up.
 */
public enum SubmissionStage {
    RECEIVED,
    AUTHENTICATING,
    VALIDATING_POLICY,
    PERSISTING,
    INDEXING,
    ACKNOWLEDGED,
    REJECTED,
    FAILED
}
