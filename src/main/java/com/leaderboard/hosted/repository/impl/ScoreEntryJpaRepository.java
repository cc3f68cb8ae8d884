package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.model.ScoreEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ScoreEntryJpaRepository extends JpaRepository<ScoreEntry, String> {
    Optional<ScoreEntry> findByLeaderboardIdAndPlayerIdAndCurrentTrue(String leaderboardId, String playerId);
    List<ScoreEntry> findByLeaderboardIdAndPlayerIdOrderByTimestampAscIdAsc(String leaderboardId, String playerId);
    List<ScoreEntry> findByLeaderboardIdAndCurrentTrue(String leaderboardId);
}
