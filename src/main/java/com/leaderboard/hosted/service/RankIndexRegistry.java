package com.leaderboard.hosted.service;

import com.leaderboard.hosted.exception.IndexInconsistencyException;
import com.leaderboard.hosted.exception.IndexUnavailableException;
import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.Player;
import com.leaderboard.hosted.ranking.IndexedScore;
import com.leaderboard.hosted.ranking.RankIndex;
import com.leaderboard.hosted.ranking.RankIndexFactory;
import com.leaderboard.hosted.repository.PlayerRepository;
import com.leaderboard.hosted.repository.ScoreStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Owns the rank index of every leaderboard and keeps it a projection of the
 * score store.
 *
 * <p>An index is loaded from the store on first use. A stale index (one whose
 * last update failed) is recovered on the next access or by the scheduled
 * verifier. Recovery holds the leaderboard's write lock, so it never
 * interleaves with a submission.
 */
@Component
public class RankIndexRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RankIndexRegistry.class);

    private final RankIndexFactory rankIndexFactory;
    private final ScoreStore scoreStore;
    private final PlayerRepository playerRepository;
    private final LeaderboardLocks locks;
    private final Map<String, IndexState> states = new ConcurrentHashMap<>();

    @Autowired
    public RankIndexRegistry(RankIndexFactory rankIndexFactory, ScoreStore scoreStore,
                             PlayerRepository playerRepository, LeaderboardLocks locks) {
        this.rankIndexFactory = rankIndexFactory;
        this.scoreStore = scoreStore;
        this.playerRepository = playerRepository;
        this.locks = locks;
    }

    /**
     * The leaderboard's index, loaded or recovered first when needed.
     *
     * @throws IndexUnavailableException if the index cannot be loaded from the store
     */
    public RankIndex indexFor(Leaderboard leaderboard) {
        IndexState state = stateOf(leaderboard);
        if (state.stale) {
            recover(state);
        }
        return state.index;
    }

    public void markStale(String leaderboardId) {
        IndexState state = states.get(leaderboardId);
        if (state != null) {
            state.stale = true;
            logger.warn("Rank index of leaderboard {} marked stale", leaderboardId);
        }
    }

    public boolean isStale(String leaderboardId) {
        IndexState state = states.get(leaderboardId);
        return state != null && state.stale;
    }

    /**
     * Discards the index contents and reloads them from the store.
     */
    public void rebuild(Leaderboard leaderboard) {
        IndexState state = stateOf(leaderboard);
        state.stale = true;
        state.forceRebuild = true;
        recover(state);
    }

    /**
     * Recovers every stale index.
     *
     * @return how many indexes were recovered
     */
    public int rebuildStale() {
        int recovered = 0;
        for (IndexState state : states.values()) {
            if (!state.stale) {
                continue;
            }
            try {
                recover(state);
                recovered++;
            } catch (IndexUnavailableException e) {
                logger.warn("Rank index of leaderboard {} is still unavailable: {}",
                    state.leaderboard.getId(), e.getMessage());
            }
        }
        return recovered;
    }

    /**
     * Compares every loaded index with the store and rebuilds the ones that
     * diverge.
     *
     * @return how many indexes were rebuilt
     */
    public int auditAll() {
        int rebuilt = 0;
        for (IndexState state : states.values()) {
            if (state.stale) {
                continue;
            }
            try {
                if (!audit(state)) {
                    rebuilt++;
                }
            } catch (IndexUnavailableException e) {
                logger.warn("Could not audit rank index of leaderboard {}: {}",
                    state.leaderboard.getId(), e.getMessage());
            }
        }
        return rebuilt;
    }

    /**
     * @return true when the index matched the store, false when it was rebuilt
     */
    public boolean audit(Leaderboard leaderboard) {
        return audit(stateOf(leaderboard));
    }

    private boolean audit(IndexState state) {
        Lock lock = locks.forLeaderboard(state.leaderboard.getId()).writeLock();
        lock.lock();
        try {
            List<IndexedScore> projection = loadProjection(state.leaderboard);
            try {
                verify(state, projection);
                return true;
            } catch (IndexInconsistencyException e) {
                logger.warn("Rebuilding rank index: {}", e.getMessage());
                state.index.rebuild(projection);
                state.stale = false;
                return false;
            }
        } catch (StorageUnavailableException e) {
            throw new IndexUnavailableException(
                "Rank index of leaderboard " + state.leaderboard.getId() + " could not be audited", e);
        } finally {
            lock.unlock();
        }
    }

    private IndexState stateOf(Leaderboard leaderboard) {
        return states.computeIfAbsent(leaderboard.getId(),
            id -> new IndexState(leaderboard, rankIndexFactory.create(leaderboard)));
    }

    private void recover(IndexState state) {
        String leaderboardId = state.leaderboard.getId();
        Lock lock = locks.forLeaderboard(leaderboardId).writeLock();
        lock.lock();
        try {
            if (!state.stale) {
                return;
            }
            List<IndexedScore> projection = loadProjection(state.leaderboard);
            if (state.forceRebuild || !rankIndexFactory.isDurable()) {
                state.index.rebuild(projection);
            } else {
                try {
                    verify(state, projection);
                } catch (IndexInconsistencyException e) {
                    logger.warn("Rebuilding rank index: {}", e.getMessage());
                    state.index.rebuild(projection);
                }
            }
            state.stale = false;
            state.forceRebuild = false;
            logger.info("Rank index of leaderboard {} ready with {} players", leaderboardId, projection.size());
        } catch (StorageUnavailableException e) {
            throw new IndexUnavailableException("Rank index of leaderboard " + leaderboardId + " is unavailable", e);
        } finally {
            lock.unlock();
        }
    }

    private void verify(IndexState state, List<IndexedScore> projection) {
        String leaderboardId = state.leaderboard.getId();
        RankIndex index = state.index;
        long indexed = index.size();
        if (indexed != projection.size()) {
            throw new IndexInconsistencyException("Leaderboard " + leaderboardId + " indexes "
                + indexed + " players but the store holds " + projection.size());
        }
        for (IndexedScore expected : projection) {
            Optional<IndexedScore> actual = index.entry(expected.getPlayerId());
            if (actual.isEmpty() || !expected.sameRankKey(actual.get())) {
                throw new IndexInconsistencyException("Leaderboard " + leaderboardId
                    + " indexes a stale entry for player " + expected.getPlayerId());
            }
        }
    }

    private List<IndexedScore> loadProjection(Leaderboard leaderboard) {
        Map<String, String> displayNames = new HashMap<>();
        for (Player player : playerRepository.findByLeaderboardId(leaderboard.getId())) {
            displayNames.put(player.getPlayerId(), player.getDisplayName());
        }
        return scoreStore.currentEntries(leaderboard.getId()).stream()
            .map(entry -> IndexedScore.of(entry, displayNames.get(entry.getPlayerId())))
            .toList();
    }

    private static final class IndexState {
        private final Leaderboard leaderboard;
        private final RankIndex index;
        private volatile boolean stale = true;
        private volatile boolean forceRebuild;

        private IndexState(Leaderboard leaderboard, RankIndex index) {
            this.leaderboard = leaderboard;
            this.index = index;
        }
    }
}
