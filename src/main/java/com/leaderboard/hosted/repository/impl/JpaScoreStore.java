package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.policy.UpdateDecision;
import com.leaderboard.hosted.policy.UpdatePolicies;
import com.leaderboard.hosted.repository.PutResult;
import com.leaderboard.hosted.repository.ScoreStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link ScoreStore} on a relational database. Each put is one transaction;
 * superseded entries are deleted except under KEEP_ALL, where they only lose
 * the current flag.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.storage.type", havingValue = "jpa", matchIfMissing = true)
public class JpaScoreStore implements ScoreStore {

    private final ScoreEntryJpaRepository jpaRepository;
    private final TransactionTemplate transactionTemplate;

    @Autowired
    public JpaScoreStore(ScoreEntryJpaRepository jpaRepository, PlatformTransactionManager transactionManager) {
        this.jpaRepository = jpaRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public PutResult put(Leaderboard leaderboard, ScoreEntry candidate) {
        return translate("store score for player " + candidate.getPlayerId(),
            () -> transactionTemplate.execute(status -> putInTransaction(leaderboard, candidate)));
    }

    private PutResult putInTransaction(Leaderboard leaderboard, ScoreEntry candidate) {
        ScoreEntry current = jpaRepository
            .findByLeaderboardIdAndPlayerIdAndCurrentTrue(leaderboard.getId(), candidate.getPlayerId())
            .orElse(null);
        UpdateDecision decision = UpdatePolicies.decide(
            leaderboard.getUpdatePolicy(), leaderboard.getOrdering(), current, candidate);
        ScoreEntry previous = current != null ? current.toBuilder().build() : null;

        if (decision == UpdateDecision.RETAIN) {
            return PutResult.builder().previous(previous).current(previous).decision(decision).build();
        }

        ScoreEntry stored = candidate.toBuilder()
            .id(candidate.getId() != null ? candidate.getId() : UUID.randomUUID().toString())
            .leaderboardId(leaderboard.getId())
            .current(decision.changesCurrent())
            .build();

        if (current != null && decision == UpdateDecision.REPLACE) {
            jpaRepository.delete(current);
            jpaRepository.flush();
        } else if (current != null && decision == UpdateDecision.APPEND_AS_CURRENT) {
            current.setCurrent(false);
            jpaRepository.save(current);
        }
        jpaRepository.save(stored);

        ScoreEntry after = decision.changesCurrent() ? stored : previous;
        return PutResult.builder()
            .previous(previous)
            .current(after != null ? after.toBuilder().build() : null)
            .decision(decision)
            .build();
    }

    @Override
    public Optional<ScoreEntry> getCurrent(String leaderboardId, String playerId) {
        return translate("read current score of player " + playerId,
            () -> jpaRepository.findByLeaderboardIdAndPlayerIdAndCurrentTrue(leaderboardId, playerId));
    }

    @Override
    public List<ScoreEntry> history(String leaderboardId, String playerId) {
        return translate("read score history of player " + playerId,
            () -> jpaRepository.findByLeaderboardIdAndPlayerIdOrderByTimestampAscIdAsc(leaderboardId, playerId));
    }

    @Override
    public List<ScoreEntry> currentEntries(String leaderboardId) {
        return translate("read current scores of leaderboard " + leaderboardId,
            () -> jpaRepository.findByLeaderboardIdAndCurrentTrue(leaderboardId));
    }

    private static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StorageUnavailableException("Failed to " + operation, e);
        }
    }
}
