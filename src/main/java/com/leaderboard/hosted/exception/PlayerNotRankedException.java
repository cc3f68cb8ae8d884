package com.leaderboard.hosted.exception;

public class PlayerNotRankedException extends LeaderboardException {
    public PlayerNotRankedException(String message) {
        super(message, "PLAYER_NOT_RANKED");
    }
}
