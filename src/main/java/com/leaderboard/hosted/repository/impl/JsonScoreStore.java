package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.policy.UpdateDecision;
import com.leaderboard.hosted.policy.UpdatePolicies;
import com.leaderboard.hosted.repository.PutResult;
import com.leaderboard.hosted.repository.ScoreStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ScoreStore} keeping one JSON file per leaderboard. Each put rewrites
 * the leaderboard's file before the in-memory view changes, so a failed write
 * leaves both untouched.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.storage.type", havingValue = "json")
public class JsonScoreStore implements ScoreStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonScoreStore.class);

    private final JsonFileStorage storage;
    private final Map<String, Map<String, PlayerScores>> cache = new ConcurrentHashMap<>();
    // Per-leaderboard locks to prevent race conditions on file writes
    private final Map<String, ReentrantLock> leaderboardLocks = new ConcurrentHashMap<>();

    public JsonScoreStore(@Value("${leaderboard.storage.directory:./data}") String dataDirectory) {
        this.storage = new JsonFileStorage(dataDirectory + "/scores");
    }

    @Override
    public PutResult put(Leaderboard leaderboard, ScoreEntry candidate) {
        String leaderboardId = leaderboard.getId();
        ReentrantLock lock = getOrCreateLock(leaderboardId);

        lock.lock();
        try {
            Map<String, PlayerScores> scores = loadScores(leaderboardId);
            PlayerScores existing = scores.get(candidate.getPlayerId());
            ScoreEntry current = existing != null ? existing.current : null;

            UpdateDecision decision = UpdatePolicies.decide(
                leaderboard.getUpdatePolicy(), leaderboard.getOrdering(), current, candidate);
            if (decision == UpdateDecision.RETAIN) {
                return PutResult.builder()
                    .previous(copy(current))
                    .current(copy(current))
                    .decision(decision)
                    .build();
            }

            ScoreEntry stored = candidate.toBuilder()
                .id(candidate.getId() != null ? candidate.getId() : UUID.randomUUID().toString())
                .leaderboardId(leaderboardId)
                .current(decision.changesCurrent())
                .build();
            PlayerScores updated = PlayerScores.apply(existing, decision, stored);

            Map<String, PlayerScores> next = new LinkedHashMap<>(scores);
            next.put(candidate.getPlayerId(), updated);
            persistToFile(leaderboardId, next);
            scores.put(candidate.getPlayerId(), updated);

            return PutResult.builder()
                .previous(copy(current))
                .current(copy(updated.current))
                .decision(decision)
                .build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ScoreEntry> getCurrent(String leaderboardId, String playerId) {
        PlayerScores scores = findPlayerScores(leaderboardId, playerId);
        return scores == null ? Optional.empty() : Optional.of(copy(scores.current));
    }

    @Override
    public List<ScoreEntry> history(String leaderboardId, String playerId) {
        PlayerScores scores = findPlayerScores(leaderboardId, playerId);
        if (scores == null) {
            return Collections.emptyList();
        }
        return scores.entries.stream().map(JsonScoreStore::copy).toList();
    }

    @Override
    public List<ScoreEntry> currentEntries(String leaderboardId) {
        if (!JsonFileStorage.isSafeKey(leaderboardId)) {
            return Collections.emptyList();
        }
        return getScoresWithLoad(leaderboardId).values().stream()
            .map(scores -> copy(scores.current))
            .toList();
    }

    private PlayerScores findPlayerScores(String leaderboardId, String playerId) {
        if (!JsonFileStorage.isSafeKey(leaderboardId) || playerId == null) {
            return null;
        }
        return getScoresWithLoad(leaderboardId).get(playerId);
    }

    private Map<String, PlayerScores> getScoresWithLoad(String leaderboardId) {
        Map<String, PlayerScores> scores = cache.get(leaderboardId);
        if (scores != null) {
            return scores;
        }
        ReentrantLock lock = getOrCreateLock(leaderboardId);
        lock.lock();
        try {
            return loadScores(leaderboardId);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock getOrCreateLock(String leaderboardId) {
        return leaderboardLocks.computeIfAbsent(leaderboardId, k -> new ReentrantLock());
    }

    // Caller holds the leaderboard lock.
    private Map<String, PlayerScores> loadScores(String leaderboardId) {
        Map<String, PlayerScores> scores = cache.get(leaderboardId);
        if (scores != null) {
            return scores;
        }
        try {
            List<ScoreEntry> entries = storage.readList(leaderboardId, ScoreEntry.class);
            scores = new ConcurrentHashMap<>(groupByPlayer(entries));
            cache.put(leaderboardId, scores);
            logger.debug("Loaded {} players for leaderboard {} from disk", scores.size(), leaderboardId);
            return scores;
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read scores for leaderboard " + leaderboardId, e);
        }
    }

    private static Map<String, PlayerScores> groupByPlayer(List<ScoreEntry> entries) {
        Map<String, List<ScoreEntry>> byPlayer = new LinkedHashMap<>();
        for (ScoreEntry entry : entries) {
            byPlayer.computeIfAbsent(entry.getPlayerId(), k -> new ArrayList<>()).add(entry);
        }
        Map<String, PlayerScores> result = new HashMap<>();
        byPlayer.forEach((playerId, playerEntries) -> {
            ScoreEntry current = playerEntries.stream()
                .filter(ScoreEntry::isCurrent)
                .reduce((first, second) -> second)
                .orElse(playerEntries.get(playerEntries.size() - 1));
            result.put(playerId, new PlayerScores(List.copyOf(playerEntries), current));
        });
        return result;
    }

    private void persistToFile(String leaderboardId, Map<String, PlayerScores> scores) {
        List<ScoreEntry> allEntries = new ArrayList<>();
        scores.values().forEach(playerScores -> allEntries.addAll(playerScores.entries));
        try {
            storage.write(leaderboardId, allEntries);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write scores for leaderboard " + leaderboardId, e);
        }
    }

    private static ScoreEntry copy(ScoreEntry entry) {
        return entry == null ? null : entry.toBuilder().build();
    }

    /**
     * Immutable history of one player, oldest first, with its current entry.
     */
    private static final class PlayerScores {
        private final List<ScoreEntry> entries;
        private final ScoreEntry current;

        private PlayerScores(List<ScoreEntry> entries, ScoreEntry current) {
            this.entries = entries;
            this.current = current;
        }

        static PlayerScores apply(PlayerScores existing, UpdateDecision decision, ScoreEntry stored) {
            if (existing == null || decision == UpdateDecision.REPLACE) {
                return new PlayerScores(List.of(stored), stored);
            }
            List<ScoreEntry> entries = new ArrayList<>(existing.entries.size() + 1);
            if (decision == UpdateDecision.APPEND_AS_CURRENT) {
                existing.entries.forEach(e -> entries.add(e.toBuilder().current(false).build()));
                entries.add(stored);
                return new PlayerScores(List.copyOf(entries), stored);
            }
            entries.addAll(existing.entries);
            entries.add(stored);
            return new PlayerScores(List.copyOf(entries), existing.current);
        }
    }
}
