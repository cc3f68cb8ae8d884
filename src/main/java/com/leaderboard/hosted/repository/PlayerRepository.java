package com.leaderboard.hosted.repository;

import com.leaderboard.hosted.model.Player;

import java.util.List;
import java.util.Optional;

public interface PlayerRepository {
    Player save(Player player);
    Optional<Player> findByLeaderboardIdAndPlayerId(String leaderboardId, String playerId);
    List<Player> findByLeaderboardId(String leaderboardId);
}
