package com.leaderboard.hosted.service;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.exception.InvalidRequestException;
import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.exception.SubmissionFailedException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.Player;
import com.leaderboard.hosted.repository.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Explicit player registration. Registered players receive a key with which
 * they sign their own submissions.
 */
@Service
public class PlayerService {

    private static final Logger logger = LoggerFactory.getLogger(PlayerService.class);

    private final LeaderboardRegistry leaderboardRegistry;
    private final PlayerRepository playerRepository;
    private final PlayerNameGenerator nameGenerator;
    private final StorageRetrier retrier;
    private final int maxDisplayNameLength;

    @Autowired
    public PlayerService(LeaderboardRegistry leaderboardRegistry, PlayerRepository playerRepository,
                         PlayerNameGenerator nameGenerator, StorageRetrier retrier,
                         LeaderboardProperties properties) {
        this.leaderboardRegistry = leaderboardRegistry;
        this.playerRepository = playerRepository;
        this.nameGenerator = nameGenerator;
        this.retrier = retrier;
        this.maxDisplayNameLength = properties.getSubmission().getMaxDisplayNameLength();
    }

    public Player register(String leaderboardId, String displayName) {
        if (displayName != null && displayName.length() > maxDisplayNameLength) {
            throw new InvalidRequestException("Display name exceeds " + maxDisplayNameLength + " characters");
        }
        Leaderboard leaderboard = leaderboardRegistry.resolve(leaderboardId);

        Player player = Player.builder()
            .leaderboardId(leaderboard.getId())
            .playerId(UUID.randomUUID().toString())
            .playerKey(UUID.randomUUID().toString())
            .displayName(displayName == null || displayName.isBlank() ? nameGenerator.generate() : displayName)
            .createdAt(Instant.now())
            .build();

        try {
            Player saved = retrier.call("Registering player", () -> playerRepository.save(player));
            logger.info("Registered player {} on leaderboard {}", saved.getPlayerId(), leaderboardId);
            return saved;
        } catch (StorageUnavailableException e) {
            throw new SubmissionFailedException("Player store unavailable, player was not registered",
                "SUBMISSION_FAILED", SubmissionStage.PERSISTING, false, e);
        }
    }
}
