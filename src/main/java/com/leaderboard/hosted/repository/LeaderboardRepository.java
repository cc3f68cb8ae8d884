package com.leaderboard.hosted.repository;

import com.leaderboard.hosted.model.Leaderboard;

import java.util.List;
import java.util.Optional;

public interface LeaderboardRepository {
    Leaderboard save(Leaderboard leaderboard);
    Optional<Leaderboard> findById(String leaderboardId);
    List<Leaderboard> findAll();
    boolean existsById(String leaderboardId);
}
