package com.leaderboard.hosted.exception;

/**
 * Base of the service's errors. The error code is what API clients see.
 */
public class LeaderboardException extends RuntimeException {
    private final String errorCode;

    public LeaderboardException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public LeaderboardException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
