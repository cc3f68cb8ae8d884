package com.leaderboard.hosted.service;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.dto.ScoreSubmissionRequest;
import com.leaderboard.hosted.exception.AuthenticationFailedException;
import com.leaderboard.hosted.exception.IndexUnavailableException;
import com.leaderboard.hosted.exception.MalformedSubmissionException;
import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.exception.SubmissionCancelledException;
import com.leaderboard.hosted.exception.SubmissionFailedException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.Player;
import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.ranking.IndexedScore;
import com.leaderboard.hosted.ranking.RankIndex;
import com.leaderboard.hosted.repository.PlayerRepository;
import com.leaderboard.hosted.repository.PutResult;
import com.leaderboard.hosted.repository.ScoreStore;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;

/**
 * Accepts score submissions: validates and authenticates them, applies the
 * leaderboard's update policy, persists the outcome and then updates the rank
 * index.
 *
 * <p>A submission is acknowledged only after the store has made it durable.
 * Submissions for the same player on the same leaderboard are applied one at
 * a time; other players are not blocked.
 */
@Service
public class SubmissionGateway {

    private static final Logger logger = LoggerFactory.getLogger(SubmissionGateway.class);

    private final LeaderboardRegistry leaderboardRegistry;
    private final PlayerRepository playerRepository;
    private final ScoreStore scoreStore;
    private final RankIndexRegistry rankIndexRegistry;
    private final LeaderboardLocks locks;
    private final StorageRetrier retrier;
    private final SubmissionSignatures signatures;
    private final PlayerNameGenerator nameGenerator;
    private final ThreadPoolTaskExecutor submissionExecutor;
    private final LeaderboardProperties.Submission config;

    @Autowired
    public SubmissionGateway(
            LeaderboardRegistry leaderboardRegistry,
            PlayerRepository playerRepository,
            ScoreStore scoreStore,
            RankIndexRegistry rankIndexRegistry,
            LeaderboardLocks locks,
            StorageRetrier retrier,
            SubmissionSignatures signatures,
            PlayerNameGenerator nameGenerator,
            @Qualifier("submissionExecutor") ThreadPoolTaskExecutor submissionExecutor,
            LeaderboardProperties properties) {
        this.leaderboardRegistry = leaderboardRegistry;
        this.playerRepository = playerRepository;
        this.scoreStore = scoreStore;
        this.rankIndexRegistry = rankIndexRegistry;
        this.locks = locks;
        this.retrier = retrier;
        this.signatures = signatures;
        this.nameGenerator = nameGenerator;
        this.submissionExecutor = submissionExecutor;
        this.config = properties.getSubmission();
    }

    /**
     * Runs the submission on the submission executor. Cancelling the returned
     * future before the submission reaches {@link SubmissionStage#PERSISTING}
     * abandons it without side effects; afterwards it completes regardless.
     */
    public Future<SubmissionReceipt> submitAsync(String leaderboardId, ScoreSubmissionRequest request) {
        return submissionExecutor.getThreadPoolExecutor().submit(() -> submit(leaderboardId, request));
    }

    public SubmissionReceipt submit(String leaderboardId, ScoreSubmissionRequest request) {
        SubmissionStage stage = SubmissionStage.RECEIVED;
        ScoreEntry candidate = validate(leaderboardId, request);
        String playerId = candidate.getPlayerId();

        stage = advance(stage, SubmissionStage.AUTHENTICATING, leaderboardId, playerId);
        Leaderboard leaderboard = leaderboardRegistry.resolve(leaderboardId);
        authenticate(leaderboard, request, candidate);

        stage = advance(stage, SubmissionStage.VALIDATING_POLICY, leaderboardId, playerId);
        RankIndex index = indexFor(leaderboard, stage);
        ensureNotCancelled(leaderboardId, playerId);

        Lock shared = locks.forLeaderboard(leaderboardId).readLock();
        Lock playerLock = locks.forPlayer(leaderboardId, playerId);
        DeferredInterrupt deferred = new DeferredInterrupt();
        PlayerUpsert upsert;
        PutResult result;
        RankedPlayer ranking = null;
        Long totalPlayers = null;
        RuntimeException indexFailure = null;
        try {
            shared.lock();
            playerLock.lock();
            try {
                ensureNotCancelled(leaderboardId, playerId);
                stage = advance(stage, SubmissionStage.PERSISTING, leaderboardId, playerId);
                // from here on the submission runs to completion; interrupts are restored at the end
                deferred.absorb();
                PlayerPlan plan;
                try {
                    plan = retrier.call("Loading player " + playerId, () -> {
                        deferred.absorb();
                        return planPlayer(leaderboardId, playerId, request.getDisplayName());
                    });
                    result = retrier.call("Persisting score of " + playerId, () -> {
                        deferred.absorb();
                        return scoreStore.put(leaderboard, candidate);
                    });
                } catch (StorageUnavailableException e) {
                    logger.error("Submission failed - leaderboard: {}, player: {}, stage: {}",
                        leaderboardId, playerId, stage);
                    throw new SubmissionFailedException("Score store unavailable, submission was not recorded",
                        "SUBMISSION_FAILED", stage, false, e);
                }
                upsert = savePlayer(plan, deferred, leaderboardId, playerId);

                stage = advance(stage, SubmissionStage.INDEXING, leaderboardId, playerId);
                if (result.currentChanged() || upsert.isDisplayNameChanged()) {
                    IndexedScore previous = result.getPrevious() != null
                        ? IndexedScore.of(result.getPrevious(), upsert.getPreviousDisplayName())
                        : null;
                    IndexedScore current = IndexedScore.of(result.getCurrent(), upsert.getDisplayName());
                    try {
                        retrier.run("Indexing score of " + playerId, () -> {
                            deferred.absorb();
                            index.insertOrUpdate(previous, current);
                        });
                    } catch (RuntimeException e) {
                        logger.error("Rank index update failed after persist - leaderboard: {}, player: {}",
                            leaderboardId, playerId, e);
                        indexFailure = e;
                    }
                }
                if (indexFailure == null) {
                    ranking = readRanking(index, leaderboardId, playerId);
                    totalPlayers = ranking != null ? readSize(index, leaderboardId) : null;
                }
            } finally {
                playerLock.unlock();
                shared.unlock();
            }

            if (indexFailure != null) {
                // the write lock needed for a rebuild is only available once ours is released
                deferred.absorb();
                recoverIndex(leaderboard, playerId, indexFailure);
                ranking = readRanking(index, leaderboardId, playerId);
                totalPlayers = ranking != null ? readSize(index, leaderboardId) : null;
            }

            advance(stage, SubmissionStage.ACKNOWLEDGED, leaderboardId, playerId);
            logger.info("Acknowledged submission - leaderboard: {}, player: {}, score: {}, decision: {}, rank: {}",
                leaderboardId, playerId, candidate.getValue(), result.getDecision(),
                ranking != null ? ranking.getRank() : null);

            return SubmissionReceipt.builder()
                .leaderboardId(leaderboardId)
                .playerId(playerId)
                .displayName(upsert.getDisplayName())
                .submitted(candidate)
                .current(result.getCurrent())
                .decision(result.getDecision())
                .ranking(ranking)
                .totalPlayers(totalPlayers)
                .build();
        } finally {
            deferred.restore();
        }
    }

    private ScoreEntry validate(String leaderboardId, ScoreSubmissionRequest request) {
        if (leaderboardId == null || leaderboardId.isBlank()) {
            throw new MalformedSubmissionException("Leaderboard id cannot be blank");
        }
        if (request == null) {
            throw new MalformedSubmissionException("Submission body is missing");
        }
        String playerId = request.getPlayerId();
        if (playerId == null || playerId.isBlank()) {
            throw new MalformedSubmissionException("Player id cannot be blank");
        }
        if (playerId.length() > config.getMaxPlayerIdLength()) {
            throw new MalformedSubmissionException("Player id exceeds " + config.getMaxPlayerIdLength() + " characters");
        }
        if (playerId.chars().anyMatch(Character::isISOControl)) {
            throw new MalformedSubmissionException("Player id contains control characters");
        }
        if (playerId.codePoints().anyMatch(cp -> cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
            throw new MalformedSubmissionException("Player id is not valid Unicode text");
        }
        Double score = request.getScore();
        if (score == null || !Double.isFinite(score)) {
            throw new MalformedSubmissionException("Score must be a finite number");
        }
        String displayName = request.getDisplayName();
        if (displayName != null && displayName.length() > config.getMaxDisplayNameLength()) {
            throw new MalformedSubmissionException(
                "Display name exceeds " + config.getMaxDisplayNameLength() + " characters");
        }
        String metadata = request.getMetadata();
        if (metadata != null && metadata.length() > config.getMaxMetadataLength()) {
            throw new MalformedSubmissionException("Metadata exceeds " + config.getMaxMetadataLength() + " characters");
        }
        if (request.getTimestamp() != null && request.getTimestamp() < 0) {
            throw new MalformedSubmissionException("Timestamp cannot be before the epoch");
        }
        if (isBlank(request.getKey()) && isBlank(request.getSignature())) {
            throw new AuthenticationFailedException("Submission carries no credentials");
        }

        Instant timestamp = request.getTimestamp() != null
            ? Instant.ofEpochMilli(request.getTimestamp())
            : Instant.now().truncatedTo(ChronoUnit.MILLIS);

        return ScoreEntry.builder()
            .id(UUID.randomUUID().toString())
            .leaderboardId(leaderboardId)
            .playerId(playerId)
            // folds -0.0 into 0.0
            .value(score + 0.0)
            .timestamp(timestamp)
            .metadata(metadata)
            .build();
    }

    private void authenticate(Leaderboard leaderboard, ScoreSubmissionRequest request, ScoreEntry candidate) {
        if (!isBlank(request.getKey())) {
            if (!LeaderboardRegistry.secretMatches(leaderboard, request.getKey())) {
                logger.warn("Rejected submission with a wrong key - leaderboard: {}, player: {}",
                    leaderboard.getId(), candidate.getPlayerId());
                throw new AuthenticationFailedException("Invalid leaderboard key");
            }
            return;
        }

        if (request.getTimestamp() == null) {
            throw new AuthenticationFailedException("Signed submissions must carry a timestamp");
        }
        long skew = Math.abs(System.currentTimeMillis() - request.getTimestamp());
        if (skew > config.getSignatureMaxSkewMs()) {
            throw new AuthenticationFailedException("Submission timestamp is outside the accepted window");
        }
        Optional<Player> player;
        try {
            player = retrier.call("Loading player " + candidate.getPlayerId(),
                () -> playerRepository.findByLeaderboardIdAndPlayerId(leaderboard.getId(), candidate.getPlayerId()));
        } catch (StorageUnavailableException e) {
            throw new SubmissionFailedException("Player store unavailable", "SUBMISSION_FAILED",
                SubmissionStage.AUTHENTICATING, false, e);
        }
        String playerKey = player.map(Player::getPlayerKey).orElse(null);
        if (playerKey == null) {
            throw new AuthenticationFailedException("Signed submissions require a registered player");
        }
        boolean valid = signatures.verify(playerKey, request.getSignature(), request.getTimestamp(),
            leaderboard.getSecret(), candidate.getPlayerId(), candidate.getValue(), candidate.getMetadata());
        if (!valid) {
            logger.warn("Rejected submission with a bad signature - leaderboard: {}, player: {}",
                leaderboard.getId(), candidate.getPlayerId());
            throw new AuthenticationFailedException("Invalid submission signature");
        }
    }

    private RankIndex indexFor(Leaderboard leaderboard, SubmissionStage stage) {
        try {
            return rankIndexRegistry.indexFor(leaderboard);
        } catch (IndexUnavailableException e) {
            throw new SubmissionFailedException(e.getMessage(), "INDEX_UNAVAILABLE", stage, false, e);
        }
    }

    private void recoverIndex(Leaderboard leaderboard, String playerId, RuntimeException cause) {
        rankIndexRegistry.markStale(leaderboard.getId());
        try {
            rankIndexRegistry.rebuild(leaderboard);
            logger.info("Rank index of leaderboard {} rebuilt after a failed update", leaderboard.getId());
        } catch (IndexUnavailableException e) {
            e.addSuppressed(cause);
            throw new SubmissionFailedException(
                "Score of " + playerId + " was recorded but the rank index is unavailable",
                "INDEX_UNAVAILABLE", SubmissionStage.INDEXING, true, e);
        }
    }

    private PlayerPlan planPlayer(String leaderboardId, String playerId, String displayName) {
        Optional<Player> existing = playerRepository.findByLeaderboardIdAndPlayerId(leaderboardId, playerId);
        if (existing.isPresent()) {
            Player player = existing.get();
            if (isBlank(displayName) || displayName.equals(player.getDisplayName())) {
                return new PlayerPlan(player, null);
            }
            return new PlayerPlan(player, player.toBuilder().displayName(displayName).build());
        }
        Player created = Player.builder()
            .leaderboardId(leaderboardId)
            .playerId(playerId)
            .displayName(isBlank(displayName) ? nameGenerator.generate() : displayName)
            .createdAt(Instant.now())
            .build();
        return new PlayerPlan(null, created);
    }

    /**
     * Saves the player record once the score is durable. A failure here leaves
     * the stored player as it was and does not fail the submission.
     */
    private PlayerUpsert savePlayer(PlayerPlan plan, DeferredInterrupt deferred,
                                    String leaderboardId, String playerId) {
        String previousName = plan.getExisting() != null ? plan.getExisting().getDisplayName() : null;
        if (plan.getPending() == null) {
            return new PlayerUpsert(previousName, previousName, false);
        }
        try {
            Player saved = retrier.call("Saving player " + playerId, () -> {
                deferred.absorb();
                return playerRepository.save(plan.getPending());
            });
            return new PlayerUpsert(saved.getDisplayName(), previousName, plan.getExisting() != null);
        } catch (StorageUnavailableException e) {
            logger.warn("Score recorded but player record was not saved - leaderboard: {}, player: {}: {}",
                leaderboardId, playerId, e.getMessage());
            return new PlayerUpsert(previousName, previousName, false);
        }
    }

    private RankedPlayer readRanking(RankIndex index, String leaderboardId, String playerId) {
        try {
            return index.rankOf(playerId).orElse(null);
        } catch (StorageUnavailableException e) {
            logger.warn("Could not read rank after submission - leaderboard: {}, player: {}: {}",
                leaderboardId, playerId, e.getMessage());
            return null;
        }
    }

    private Long readSize(RankIndex index, String leaderboardId) {
        try {
            return index.size();
        } catch (StorageUnavailableException e) {
            logger.warn("Could not read size of leaderboard {}: {}", leaderboardId, e.getMessage());
            return null;
        }
    }

    private void ensureNotCancelled(String leaderboardId, String playerId) {
        if (Thread.currentThread().isInterrupted()) {
            logger.info("Submission cancelled before persisting - leaderboard: {}, player: {}", leaderboardId, playerId);
            throw new SubmissionCancelledException("Submission was cancelled before it was recorded");
        }
    }

    private static SubmissionStage advance(SubmissionStage from, SubmissionStage to,
                                           String leaderboardId, String playerId) {
        logger.debug("Submission {} -> {} - leaderboard: {}, player: {}", from, to, leaderboardId, playerId);
        return to;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    private static class PlayerPlan {
        /** Stored record, null for a first submission. */
        Player existing;
        /** Record to save after the score, null when nothing changes. */
        Player pending;
    }

    @Value
    private static class PlayerUpsert {
        String displayName;
        String previousDisplayName;
        boolean displayNameChanged;
    }

    /**
     * Interrupts received while a submission is persisting. They are cleared
     * before each store call and re-asserted once the submission has finished.
     */
    private static final class DeferredInterrupt {
        private boolean pending;

        void absorb() {
            if (Thread.interrupted()) {
                pending = true;
            }
        }

        void restore() {
            absorb();
            if (pending) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
