package com.leaderboard.hosted.exception;

/**
 * Transient failure of the score store or a remote rank index. Retried by
 * the submission gateway and never returned to clients as-is.
 */
public class StorageUnavailableException extends LeaderboardException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, "STORAGE_UNAVAILABLE", cause);
    }
}
