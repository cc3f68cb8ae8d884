package com.leaderboard.hosted.controller;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.dto.RankingResponse;
import com.leaderboard.hosted.dto.ScoreSubmissionRequest;
import com.leaderboard.hosted.dto.SubmissionResponse;
import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.service.LeaderboardQueryService;
import com.leaderboard.hosted.service.SubmissionGateway;
import com.leaderboard.hosted.service.SubmissionReceipt;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Game-facing score endpoints.
 */
@RestController
@RequestMapping("/api/v1/scores")
public class ScoreController {

    private static final Logger logger = LoggerFactory.getLogger(ScoreController.class);

    private final SubmissionGateway submissionGateway;
    private final LeaderboardQueryService queryService;
    private final LeaderboardProperties properties;

    @Autowired
    public ScoreController(SubmissionGateway submissionGateway, LeaderboardQueryService queryService,
                           LeaderboardProperties properties) {
        this.submissionGateway = submissionGateway;
        this.queryService = queryService;
        this.properties = properties;
    }

    /**
     * Submit a score.
     * POST /api/v1/scores/{leaderboardId}
     */
    @PostMapping("/{leaderboardId}")
    public ResponseEntity<SubmissionResponse> submitScore(
            @PathVariable String leaderboardId,
            @Valid @RequestBody ScoreSubmissionRequest request) {

        logger.info("Received score submission - leaderboard: {}, player: {}, score: {}",
            leaderboardId, request.getPlayerId(), request.getScore());

        try {
            SubmissionReceipt receipt = submissionGateway.submit(leaderboardId, request);

            SubmissionResponse response = SubmissionResponse.builder()
                .leaderboardId(leaderboardId)
                .playerId(receipt.getPlayerId())
                .displayName(receipt.getDisplayName())
                .submittedScore(receipt.getSubmitted().getValue())
                .currentScore(receipt.getCurrent().getValue())
                .currentTimestamp(receipt.getCurrent().getTimestamp())
                .improved(receipt.isImproved())
                .decision(receipt.getDecision().name())
                .rank(receipt.getRanking() != null ? receipt.getRanking().getRank() : null)
                .totalPlayers(receipt.getTotalPlayers())
                .acknowledgedAt(Instant.now())
                .build();

            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error submitting score - leaderboard: {}, player: {}, error: {}",
                leaderboardId, request.getPlayerId(), e.getMessage());
            throw e;
        }
    }

    /**
     * Top of a leaderboard.
     * GET /api/v1/scores/{leaderboardId}?limit=N
     */
    @GetMapping("/{leaderboardId}")
    public ResponseEntity<RankingResponse> getScores(
            @PathVariable String leaderboardId,
            @RequestParam(required = false) Integer limit,
            @RequestHeader(value = LeaderboardController.KEY_HEADER, required = false) String key) {

        int effectiveLimit = limit != null ? limit : properties.getQuery().getDefaultLimit();
        logger.info("Received GET request for scores - leaderboard: {}, limit: {}", leaderboardId, effectiveLimit);

        List<RankedPlayer> players = queryService.top(leaderboardId, effectiveLimit, key);
        long totalPlayers = queryService.totalPlayers(leaderboardId, key);

        return ResponseEntity.ok(RankingResponse.builder()
            .leaderboardId(leaderboardId)
            .players(players)
            .totalPlayers(totalPlayers)
            .retrievedAt(Instant.now())
            .build());
    }
}
