package com.leaderboard.hosted.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Write coordination for submissions.
 *
 * <p>Submissions hold their leaderboard's read lock plus the stripe lock of
 * their {@code (leaderboard, player)} pair, so writes for one player are
 * serialized while different players proceed in parallel. Index rebuilds and
 * audits take the leaderboard's write lock, which waits for in-flight
 * submissions and holds off new ones. Stripe locks are always acquired last.
 */
@Component
public class LeaderboardLocks {

    private static final int PLAYER_STRIPES = 256;

    private final Map<String, ReadWriteLock> leaderboardLocks = new ConcurrentHashMap<>();
    private final Lock[] playerStripes = new Lock[PLAYER_STRIPES];

    public LeaderboardLocks() {
        for (int i = 0; i < PLAYER_STRIPES; i++) {
            playerStripes[i] = new ReentrantLock();
        }
    }

    public ReadWriteLock forLeaderboard(String leaderboardId) {
        return leaderboardLocks.computeIfAbsent(leaderboardId, k -> new ReentrantReadWriteLock());
    }

    public Lock forPlayer(String leaderboardId, String playerId) {
        int hash = 31 * leaderboardId.hashCode() + playerId.hashCode();
        hash ^= (hash >>> 16);
        return playerStripes[Math.floorMod(hash, PLAYER_STRIPES)];
    }
}
