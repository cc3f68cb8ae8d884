package com.leaderboard.hosted.exception;

import com.leaderboard.hosted.service.SubmissionStage;

/**
 * A submission that passed authentication but could not be completed.
 * The caller may retry it.
 */
public class SubmissionFailedException extends LeaderboardException {
    private final SubmissionStage stage;
    private final boolean persisted;

    public SubmissionFailedException(String message, String errorCode, SubmissionStage stage,
                                     boolean persisted, Throwable cause) {
        super(message, errorCode, cause);
        this.stage = stage;
        this.persisted = persisted;
    }

    public SubmissionStage getStage() {
        return stage;
    }

    /**
     * True when the entry reached the score store before the failure.
     */
    public boolean isPersisted() {
        return persisted;
    }
}
