package com.leaderboard.hosted.controller;

import com.leaderboard.hosted.dto.CreateLeaderboardRequest;
import com.leaderboard.hosted.dto.LeaderboardResponse;
import com.leaderboard.hosted.dto.UpdateLeaderboardRequest;
import com.leaderboard.hosted.exception.LeaderboardNotFoundException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.service.AdminAuthenticator;
import com.leaderboard.hosted.service.LeaderboardRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Leaderboard administration. Every call needs the admin bearer token.
 */
@RestController
@RequestMapping("/api/v1/admin/leaderboards")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final LeaderboardRegistry leaderboardRegistry;
    private final AdminAuthenticator adminAuthenticator;

    @Autowired
    public AdminController(LeaderboardRegistry leaderboardRegistry, AdminAuthenticator adminAuthenticator) {
        this.leaderboardRegistry = leaderboardRegistry;
        this.adminAuthenticator = adminAuthenticator;
    }

    /**
     * Create a new leaderboard. The response carries its secret.
     * POST /api/v1/admin/leaderboards
     */
    @PostMapping
    public ResponseEntity<LeaderboardResponse> createLeaderboard(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody CreateLeaderboardRequest request) {

        adminAuthenticator.check(authorization);
        logger.info("Received request to create leaderboard - name: {}, ordering: {}, policy: {}",
            request.getName(), request.getOrdering(), request.getUpdatePolicy());

        Leaderboard leaderboard = leaderboardRegistry.provision(request.getName(), request.getOrdering(),
            request.getUpdatePolicy(), request.getCreatedBy(), request.getMetadata());

        return ResponseEntity.status(HttpStatus.CREATED).body(LeaderboardResponse.from(leaderboard, true));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String id) {

        adminAuthenticator.check(authorization);
        Leaderboard leaderboard = leaderboardRegistry.find(id)
            .orElseThrow(() -> new LeaderboardNotFoundException("Leaderboard not found: " + id));
        return ResponseEntity.ok(LeaderboardResponse.from(leaderboard, false));
    }

    /**
     * POST /api/v1/admin/leaderboards/{id}/rotate-key
     */
    @PostMapping("/{id}/rotate-key")
    public ResponseEntity<LeaderboardResponse> rotateKey(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String id) {

        adminAuthenticator.check(authorization);
        logger.info("Received request to rotate key - leaderboard: {}", id);
        return ResponseEntity.ok(LeaderboardResponse.from(leaderboardRegistry.rotateSecret(id), true));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<LeaderboardResponse> updateLeaderboard(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String id,
            @Valid @RequestBody UpdateLeaderboardRequest request) {

        adminAuthenticator.check(authorization);
        logger.info("Received request to update leaderboard - leaderboard: {}, name: {}", id, request.getName());
        Leaderboard updated = leaderboardRegistry.updateMetadata(id, request.getName(), request.getMetadata());
        return ResponseEntity.ok(LeaderboardResponse.from(updated, false));
    }

    /**
     * Soft delete; scores are kept.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<LeaderboardResponse> deleteLeaderboard(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String id) {

        adminAuthenticator.check(authorization);
        logger.info("Received request to delete leaderboard - leaderboard: {}", id);
        return ResponseEntity.ok(LeaderboardResponse.from(leaderboardRegistry.softDelete(id), false));
    }
}
