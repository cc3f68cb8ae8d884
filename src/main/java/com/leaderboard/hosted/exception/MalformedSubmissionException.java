package com.leaderboard.hosted.exception;

public class MalformedSubmissionException extends LeaderboardException {
    public MalformedSubmissionException(String message) {
        super(message, "MALFORMED_SUBMISSION");
    }
}
