package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.model.Player;
import com.leaderboard.hosted.model.PlayerId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerJpaRepository extends JpaRepository<Player, PlayerId> {
    Optional<Player> findByLeaderboardIdAndPlayerId(String leaderboardId, String playerId);
    List<Player> findByLeaderboardId(String leaderboardId);
}
