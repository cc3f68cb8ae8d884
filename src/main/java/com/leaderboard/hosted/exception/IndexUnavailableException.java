package com.leaderboard.hosted.exception;

public class IndexUnavailableException extends LeaderboardException {
    public IndexUnavailableException(String message, Throwable cause) {
        super(message, "INDEX_UNAVAILABLE", cause);
    }
}
