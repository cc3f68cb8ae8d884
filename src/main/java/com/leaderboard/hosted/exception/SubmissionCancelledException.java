package com.leaderboard.hosted.exception;

public class SubmissionCancelledException extends LeaderboardException {
    public SubmissionCancelledException(String message) {
        super(message, "SUBMISSION_CANCELLED");
    }
}
