package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.repository.LeaderboardRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "leaderboard.storage.type", havingValue = "jpa", matchIfMissing = true)
public class JpaLeaderboardRepositoryImpl implements LeaderboardRepository {
    
    private final LeaderboardJpaRepository jpaRepository;
    
    @Autowired
    public JpaLeaderboardRepositoryImpl(LeaderboardJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Leaderboard save(Leaderboard leaderboard) {
        return jpaRepository.save(leaderboard);
    }
    
    @Override
    public Optional<Leaderboard> findById(String leaderboardId) {
        if (leaderboardId == null || leaderboardId.isBlank()) {
            return Optional.empty();
        }
        return jpaRepository.findById(leaderboardId);
    }

    @Override
    public List<Leaderboard> findAll() {
        return jpaRepository.findAll();
    }
    
    @Override
    public boolean existsById(String leaderboardId) {
        return findById(leaderboardId).isPresent();
    }
}
