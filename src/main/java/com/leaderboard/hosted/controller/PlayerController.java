package com.leaderboard.hosted.controller;

import com.leaderboard.hosted.dto.RegisterPlayerRequest;
import com.leaderboard.hosted.dto.RegisteredPlayerResponse;
import com.leaderboard.hosted.model.Player;
import com.leaderboard.hosted.service.PlayerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/leaderboards")
public class PlayerController {

    private static final Logger logger = LoggerFactory.getLogger(PlayerController.class);

    private final PlayerService playerService;

    @Autowired
    public PlayerController(PlayerService playerService) {
        this.playerService = playerService;
    }

    /**
     * Register a player that signs its own submissions.
     * POST /api/v1/leaderboards/{id}/players
     */
    @PostMapping("/{id}/players")
    public ResponseEntity<RegisteredPlayerResponse> registerPlayer(
            @PathVariable String id,
            @RequestBody(required = false) RegisterPlayerRequest request) {

        logger.info("Received player registration - leaderboard: {}", id);

        Player player = playerService.register(id, request != null ? request.getDisplayName() : null);

        RegisteredPlayerResponse response = RegisteredPlayerResponse.builder()
            .leaderboardId(id)
            .playerId(player.getPlayerId())
            .displayName(player.getDisplayName())
            .key(player.getPlayerKey())
            .createdAt(player.getCreatedAt())
            .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
