package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.model.Player;
import com.leaderboard.hosted.repository.PlayerRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

@Repository
@ConditionalOnProperty(name = "leaderboard.storage.type", havingValue = "json")
public class JsonPlayerRepository implements PlayerRepository {

    private final JsonFileStorage storage;
    private final Map<String, Map<String, Player>> cache = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> leaderboardLocks = new ConcurrentHashMap<>();

    public JsonPlayerRepository(@Value("${leaderboard.storage.directory:./data}") String dataDirectory) {
        this.storage = new JsonFileStorage(dataDirectory + "/players");
    }

    @Override
    public Player save(Player player) {
        if (player == null || player.getPlayerId() == null || player.getLeaderboardId() == null) {
            throw new IllegalArgumentException("Player must have a leaderboard id and a player id");
        }
        String leaderboardId = player.getLeaderboardId();
        ReentrantLock lock = getOrCreateLock(leaderboardId);

        lock.lock();
        try {
            Map<String, Player> players = loadPlayers(leaderboardId);
            Map<String, Player> next = new LinkedHashMap<>(players);
            next.put(player.getPlayerId(), player);
            storage.write(leaderboardId, new ArrayList<>(next.values()));
            players.put(player.getPlayerId(), player);
            return player.toBuilder().build();
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to save player " + player.getPlayerId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Player> findByLeaderboardIdAndPlayerId(String leaderboardId, String playerId) {
        if (!JsonFileStorage.isSafeKey(leaderboardId) || playerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(getPlayersWithLoad(leaderboardId).get(playerId))
            .map(player -> player.toBuilder().build());
    }

    @Override
    public List<Player> findByLeaderboardId(String leaderboardId) {
        if (!JsonFileStorage.isSafeKey(leaderboardId)) {
            return Collections.emptyList();
        }
        return getPlayersWithLoad(leaderboardId).values().stream()
            .map(player -> player.toBuilder().build())
            .toList();
    }

    private Map<String, Player> getPlayersWithLoad(String leaderboardId) {
        Map<String, Player> players = cache.get(leaderboardId);
        if (players != null) {
            return players;
        }
        ReentrantLock lock = getOrCreateLock(leaderboardId);
        lock.lock();
        try {
            return loadPlayers(leaderboardId);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock getOrCreateLock(String leaderboardId) {
        return leaderboardLocks.computeIfAbsent(leaderboardId, k -> new ReentrantLock());
    }

    // Caller holds the leaderboard lock.
    private Map<String, Player> loadPlayers(String leaderboardId) {
        Map<String, Player> players = cache.get(leaderboardId);
        if (players != null) {
            return players;
        }
        try {
            players = new ConcurrentHashMap<>();
            for (Player player : storage.readList(leaderboardId, Player.class)) {
                players.put(player.getPlayerId(), player);
            }
            cache.put(leaderboardId, players);
            return players;
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read players for leaderboard " + leaderboardId, e);
        }
    }
}
