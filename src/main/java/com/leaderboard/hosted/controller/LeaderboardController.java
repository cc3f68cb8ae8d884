package com.leaderboard.hosted.controller;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.dto.PlayerRankResponse;
import com.leaderboard.hosted.dto.RankingResponse;
import com.leaderboard.hosted.dto.ScoreHistoryResponse;
import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.service.LeaderboardQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/leaderboards")
public class LeaderboardController {

    static final String KEY_HEADER = "X-Leaderboard-Key";

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);

    private final LeaderboardQueryService queryService;
    private final LeaderboardProperties properties;

    @Autowired
    public LeaderboardController(LeaderboardQueryService queryService, LeaderboardProperties properties) {
        this.queryService = queryService;
        this.properties = properties;
    }

    /**
     * Get top N players from a leaderboard.
     * GET /api/v1/leaderboards/{id}/top?limit=N
     */
    @GetMapping("/{id}/top")
    public ResponseEntity<RankingResponse> getTopN(
            @PathVariable String id,
            @RequestParam(required = false) Integer limit,
            @RequestHeader(value = KEY_HEADER, required = false) String key) {

        int effectiveLimit = limit != null ? limit : properties.getQuery().getDefaultLimit();
        logger.info("Received GET request for top N players - leaderboard: {}, limit: {}", id, effectiveLimit);

        try {
            List<RankedPlayer> players = queryService.top(id, effectiveLimit, key);
            long totalPlayers = queryService.totalPlayers(id, key);

            RankingResponse response = RankingResponse.builder()
                .leaderboardId(id)
                .players(players)
                .totalPlayers(totalPlayers)
                .retrievedAt(Instant.now())
                .build();

            logger.info("Retrieved top {} players - leaderboard: {}, totalPlayers: {}, returned: {}",
                effectiveLimit, id, totalPlayers, players.size());

            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving top N players - leaderboard: {}, limit: {}, error: {}",
                id, effectiveLimit, e.getMessage());
            throw e;
        }
    }

    /**
     * GET /api/v1/leaderboards/{id}/players/{playerId}/rank
     */
    @GetMapping("/{id}/players/{playerId}/rank")
    public ResponseEntity<PlayerRankResponse> getRank(
            @PathVariable String id,
            @PathVariable String playerId,
            @RequestHeader(value = KEY_HEADER, required = false) String key) {

        logger.debug("Received GET request for rank - leaderboard: {}, player: {}", id, playerId);

        RankedPlayer player = queryService.rankOf(id, playerId, key);
        return ResponseEntity.ok(PlayerRankResponse.builder()
            .leaderboardId(id)
            .player(player)
            .totalPlayers(queryService.totalPlayers(id, key))
            .retrievedAt(Instant.now())
            .build());
    }

    /**
     * GET /api/v1/leaderboards/{id}/players/{playerId}/around?window=N
     */
    @GetMapping("/{id}/players/{playerId}/around")
    public ResponseEntity<RankingResponse> getAround(
            @PathVariable String id,
            @PathVariable String playerId,
            @RequestParam(required = false) Integer window,
            @RequestHeader(value = KEY_HEADER, required = false) String key) {

        int effectiveWindow = window != null ? window : properties.getQuery().getDefaultWindow();
        logger.debug("Received GET request for neighbours - leaderboard: {}, player: {}, window: {}",
            id, playerId, effectiveWindow);

        List<RankedPlayer> players = queryService.around(id, playerId, effectiveWindow, key);
        return ResponseEntity.ok(RankingResponse.builder()
            .leaderboardId(id)
            .players(players)
            .totalPlayers(queryService.totalPlayers(id, key))
            .retrievedAt(Instant.now())
            .build());
    }

    /**
     * GET /api/v1/leaderboards/{id}/players/{playerId}/history
     */
    @GetMapping("/{id}/players/{playerId}/history")
    public ResponseEntity<ScoreHistoryResponse> getHistory(
            @PathVariable String id,
            @PathVariable String playerId,
            @RequestHeader(value = KEY_HEADER, required = false) String key) {

        List<ScoreEntry> entries = queryService.history(id, playerId, key);
        return ResponseEntity.ok(ScoreHistoryResponse.builder()
            .leaderboardId(id)
            .playerId(playerId)
            .entries(entries)
            .build());
    }
}
