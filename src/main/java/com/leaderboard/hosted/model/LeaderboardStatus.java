package com.leaderboard.hosted.model;

public enum LeaderboardStatus {
    ACTIVE,
    DELETED
}
