package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.model.Player;
import com.leaderboard.hosted.repository.PlayerRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "leaderboard.storage.type", havingValue = "jpa", matchIfMissing = true)
public class JpaPlayerRepositoryImpl implements PlayerRepository {

    private final PlayerJpaRepository jpaRepository;

    @Autowired
    public JpaPlayerRepositoryImpl(PlayerJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Player save(Player player) {
        try {
            return jpaRepository.save(player);
        } catch (TransientDataAccessException | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StorageUnavailableException("Failed to save player " + player.getPlayerId(), e);
        }
    }

    @Override
    public Optional<Player> findByLeaderboardIdAndPlayerId(String leaderboardId, String playerId) {
        try {
            return jpaRepository.findByLeaderboardIdAndPlayerId(leaderboardId, playerId);
        } catch (TransientDataAccessException | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StorageUnavailableException("Failed to read player " + playerId, e);
        }
    }

    @Override
    public List<Player> findByLeaderboardId(String leaderboardId) {
        try {
            return jpaRepository.findByLeaderboardId(leaderboardId);
        } catch (TransientDataAccessException | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StorageUnavailableException("Failed to read players of leaderboard " + leaderboardId, e);
        }
    }
}
