package com.leaderboard.hosted.service;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.exception.AuthenticationFailedException;
import com.leaderboard.hosted.exception.IndexUnavailableException;
import com.leaderboard.hosted.exception.InvalidRequestException;
import com.leaderboard.hosted.exception.PlayerNotRankedException;
import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.ranking.RankIndex;
import com.leaderboard.hosted.repository.ScoreStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;

/**
 * Rank queries. These are served from the rank index only; the score store
 * is read for history alone.
 *
 * <p>When {@code leaderboard.query.require-key} is set every query must carry
 * the leaderboard key.
 */
@Service
public class LeaderboardQueryService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardQueryService.class);

    private final LeaderboardRegistry leaderboardRegistry;
    private final RankIndexRegistry rankIndexRegistry;
    private final ScoreStore scoreStore;
    private final StorageRetrier retrier;
    private final LeaderboardProperties.Query config;

    @Autowired
    public LeaderboardQueryService(
            LeaderboardRegistry leaderboardRegistry,
            RankIndexRegistry rankIndexRegistry,
            ScoreStore scoreStore,
            StorageRetrier retrier,
            LeaderboardProperties properties) {
        this.leaderboardRegistry = leaderboardRegistry;
        this.rankIndexRegistry = rankIndexRegistry;
        this.scoreStore = scoreStore;
        this.retrier = retrier;
        this.config = properties.getQuery();
    }

    /**
     * Best {@code limit} players, rank 1 first.
     */
    public List<RankedPlayer> top(String leaderboardId, int limit, String key) {
        if (limit < 1 || limit > config.getMaxLimit()) {
            throw new InvalidRequestException("Limit must be between 1 and " + config.getMaxLimit());
        }
        return read(leaderboardId, key, index -> index.top(limit));
    }

    public RankedPlayer rankOf(String leaderboardId, String playerId, String key) {
        requirePlayerId(playerId);
        return read(leaderboardId, key, index -> index.rankOf(playerId))
            .orElseThrow(() -> new PlayerNotRankedException(
                "Player " + playerId + " has no score on leaderboard " + leaderboardId));
    }

    /**
     * The player and up to {@code window} neighbours on each side.
     */
    public List<RankedPlayer> around(String leaderboardId, String playerId, int window, String key) {
        requirePlayerId(playerId);
        if (window < 0 || window > config.getMaxWindow()) {
            throw new InvalidRequestException("Window must be between 0 and " + config.getMaxWindow());
        }
        List<RankedPlayer> neighbourhood = read(leaderboardId, key, index -> index.around(playerId, window));
        if (neighbourhood.isEmpty()) {
            throw new PlayerNotRankedException("Player " + playerId + " has no score on leaderboard " + leaderboardId);
        }
        return neighbourhood;
    }

    public long totalPlayers(String leaderboardId, String key) {
        return read(leaderboardId, key, RankIndex::size);
    }

    /**
     * Retained entries of the player, oldest first.
     */
    public List<ScoreEntry> history(String leaderboardId, String playerId, String key) {
        requirePlayerId(playerId);
        Leaderboard leaderboard = resolve(leaderboardId, key);
        try {
            return retrier.call("Loading history of " + playerId,
                () -> scoreStore.history(leaderboard.getId(), playerId));
        } catch (StorageUnavailableException e) {
            throw new IndexUnavailableException("Score history is temporarily unavailable", e);
        }
    }

    private <T> T read(String leaderboardId, String key, Function<RankIndex, T> query) {
        Leaderboard leaderboard = resolve(leaderboardId, key);
        RankIndex index = rankIndexRegistry.indexFor(leaderboard);
        try {
            return query.apply(index);
        } catch (StorageUnavailableException e) {
            logger.warn("Rank index read failed - leaderboard: {}: {}", leaderboardId, e.getMessage());
            throw new IndexUnavailableException("Rank index of leaderboard " + leaderboardId + " is unavailable", e);
        }
    }

    private Leaderboard resolve(String leaderboardId, String key) {
        Leaderboard leaderboard = leaderboardRegistry.resolve(leaderboardId);
        if (config.isRequireKey() && !LeaderboardRegistry.secretMatches(leaderboard, key)) {
            throw new AuthenticationFailedException("Invalid leaderboard key");
        }
        return leaderboard;
    }

    private static void requirePlayerId(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new InvalidRequestException("Player id cannot be blank");
        }
    }
}
