package com.leaderboard.hosted.exception;

/**
 * Missing or wrong leaderboard key, signature or admin token. Never retried.
 */
public class AuthenticationFailedException extends LeaderboardException {
    public AuthenticationFailedException(String message) {
        super(message, "AUTHENTICATION_FAILED");
    }
}
