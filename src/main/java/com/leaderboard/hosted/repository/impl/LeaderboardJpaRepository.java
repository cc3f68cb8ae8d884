package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.model.Leaderboard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LeaderboardJpaRepository extends JpaRepository<Leaderboard, String> {
}
