package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.repository.LeaderboardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

@Repository
@ConditionalOnProperty(name = "leaderboard.storage.type", havingValue = "json")
public class JsonLeaderboardRepository implements LeaderboardRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonLeaderboardRepository.class);

    private final JsonFileStorage storage;
    private final Map<String, Leaderboard> cache = new ConcurrentHashMap<>();
    // Per-leaderboard locks to prevent race conditions on file writes
    private final Map<String, ReentrantLock> leaderboardLocks = new ConcurrentHashMap<>();

    public JsonLeaderboardRepository(@Value("${leaderboard.storage.directory:./data}") String dataDirectory) {
        this.storage = new JsonFileStorage(dataDirectory + "/leaderboards");
        loadAllLeaderboards();
    }

    private void loadAllLeaderboards() {
        try {
            for (String key : storage.keys()) {
                loadLeaderboard(key);
            }
            logger.info("Loaded {} leaderboards from {}", cache.size(), storage.getDirectory());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load leaderboards from " + storage.getDirectory(), e);
        }
    }

    private void loadLeaderboard(String key) {
        try {
            storage.read(key, Leaderboard.class)
                .filter(leaderboard -> key.equals(leaderboard.getId()))
                .ifPresentOrElse(
                    leaderboard -> cache.put(leaderboard.getId(), leaderboard),
                    () -> logger.warn("Skipping leaderboard file {} whose id does not match its name", key));
        } catch (IOException e) {
            logger.warn("Skipping unreadable leaderboard file {}: {}", key, e.getMessage());
        }
    }

    @Override
    public Leaderboard save(Leaderboard leaderboard) {
        if (leaderboard == null) {
            throw new IllegalArgumentException("Leaderboard cannot be null");
        }
        if (!JsonFileStorage.isSafeKey(leaderboard.getId())) {
            throw new IllegalArgumentException("Leaderboard id is not usable as a storage key: " + leaderboard.getId());
        }

        String id = leaderboard.getId();
        ReentrantLock lock = leaderboardLocks.computeIfAbsent(id, k -> new ReentrantLock());

        lock.lock();
        try {
            storage.write(id, leaderboard);
            cache.put(id, leaderboard);
            return leaderboard;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save leaderboard " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Leaderboard> findById(String leaderboardId) {
        if (leaderboardId == null || leaderboardId.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(leaderboardId));
    }

    @Override
    public List<Leaderboard> findAll() {
        return new ArrayList<>(cache.values());
    }

    @Override
    public boolean existsById(String leaderboardId) {
        return findById(leaderboardId).isPresent();
    }
}
