package com.leaderboard.hosted.ranking;

import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreOrdering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link RankIndex} backed by an {@link OrderStatisticTree}. Each leaderboard
 * owns its own instance and lock, so leaderboards never contend with each
 * other; within a leaderboard readers share the lock and writers hold it only
 * for the O(log n) tree update.
 */
public class InMemoryRankIndex implements RankIndex {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRankIndex.class);

    private final String leaderboardId;
    private final OrderStatisticTree<IndexedScore> tree;
    private final Map<String, IndexedScore> byPlayer = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryRankIndex(String leaderboardId, ScoreOrdering ordering) {
        this.leaderboardId = leaderboardId;
        this.tree = new OrderStatisticTree<>(RankOrder.of(ordering));
    }

    @Override
    public void insertOrUpdate(IndexedScore previous, IndexedScore current) {
        lock.writeLock().lock();
        try {
            IndexedScore stale = byPlayer.get(current.getPlayerId());
            if (stale == null) {
                stale = previous;
            }
            if (stale != null) {
                tree.remove(stale);
            }
            tree.add(current);
            byPlayer.put(current.getPlayerId(), current);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<RankedPlayer> top(int n) {
        lock.readLock().lock();
        try {
            return ranked(tree.slice(0, n), 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<RankedPlayer> rankOf(String playerId) {
        lock.readLock().lock();
        try {
            IndexedScore entry = byPlayer.get(playerId);
            if (entry == null) {
                return Optional.empty();
            }
            int index = tree.indexOf(entry);
            return index < 0 ? Optional.empty() : Optional.of(entry.toRankedPlayer(index + 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RankedPlayer> around(String playerId, int window) {
        lock.readLock().lock();
        try {
            IndexedScore entry = byPlayer.get(playerId);
            if (entry == null) {
                return Collections.emptyList();
            }
            int index = tree.indexOf(entry);
            if (index < 0) {
                return Collections.emptyList();
            }
            int from = Math.max(0, index - window);
            return ranked(tree.slice(from, index + window + 1), from);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return tree.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<IndexedScore> entry(String playerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byPlayer.get(playerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> playerIds() {
        lock.readLock().lock();
        try {
            return new HashSet<>(byPlayer.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void rebuild(Collection<IndexedScore> entries) {
        lock.writeLock().lock();
        try {
            tree.clear();
            byPlayer.clear();
            for (IndexedScore entry : entries) {
                IndexedScore replaced = byPlayer.put(entry.getPlayerId(), entry);
                if (replaced != null) {
                    tree.remove(replaced);
                }
                tree.add(entry);
            }
            logger.debug("Rebuilt rank index of leaderboard {} with {} players", leaderboardId, byPlayer.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static List<RankedPlayer> ranked(List<IndexedScore> slice, int offset) {
        List<RankedPlayer> result = new ArrayList<>(slice.size());
        for (int i = 0; i < slice.size(); i++) {
            result.add(slice.get(i).toRankedPlayer(offset + i + 1));
        }
        return result;
    }
}
