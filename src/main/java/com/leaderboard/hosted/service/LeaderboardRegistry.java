package com.leaderboard.hosted.service;

import com.leaderboard.hosted.exception.InvalidRequestException;
import com.leaderboard.hosted.exception.LeaderboardNotFoundException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.LeaderboardStatus;
import com.leaderboard.hosted.model.ScoreOrdering;
import com.leaderboard.hosted.model.UpdatePolicy;
import com.leaderboard.hosted.repository.LeaderboardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Public leaderboard ids, their secrets and ranking policies.
 *
 * <p>Lookups are served from a cache and never lock. Administrative changes
 * lock only the affected leaderboard.
 */
@Service
public class LeaderboardRegistry {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardRegistry.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final LeaderboardRepository leaderboardRepository;
    private final Map<String, Leaderboard> cache = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> recordLocks = new ConcurrentHashMap<>();

    @Autowired
    public LeaderboardRegistry(LeaderboardRepository leaderboardRepository) {
        this.leaderboardRepository = leaderboardRepository;
    }

    /**
     * @throws LeaderboardNotFoundException if the id is unknown or the leaderboard was deleted
     */
    public Leaderboard resolve(String leaderboardId) {
        return find(leaderboardId)
            .filter(Leaderboard::isActive)
            .orElseThrow(() -> new LeaderboardNotFoundException("Leaderboard not found: " + leaderboardId));
    }

    /**
     * Looks up a leaderboard whatever its status.
     */
    public Optional<Leaderboard> find(String leaderboardId) {
        if (leaderboardId == null || leaderboardId.isBlank()) {
            return Optional.empty();
        }
        Leaderboard cached = cache.get(leaderboardId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Leaderboard> loaded = leaderboardRepository.findById(leaderboardId);
        loaded.ifPresent(leaderboard -> cache.putIfAbsent(leaderboardId, leaderboard));
        return loaded;
    }

    public boolean authenticate(String leaderboardId, String suppliedKey) {
        return secretMatches(resolve(leaderboardId), suppliedKey);
    }

    /**
     * Constant-time comparison of the supplied key with the leaderboard secret.
     */
    public static boolean secretMatches(Leaderboard leaderboard, String suppliedKey) {
        if (suppliedKey == null || suppliedKey.isEmpty() || leaderboard.getSecret() == null) {
            return false;
        }
        return MessageDigest.isEqual(
            leaderboard.getSecret().getBytes(StandardCharsets.UTF_8),
            suppliedKey.getBytes(StandardCharsets.UTF_8));
    }

    public List<Leaderboard> activeLeaderboards() {
        return leaderboardRepository.findAll().stream()
            .filter(Leaderboard::isActive)
            .toList();
    }

    public Leaderboard provision(String name, ScoreOrdering ordering, UpdatePolicy updatePolicy,
                                 String createdBy, Map<String, Object> metadata) {
        if (ordering == null) {
            throw new InvalidRequestException("Ordering is required");
        }
        if (updatePolicy == null) {
            throw new InvalidRequestException("Update policy is required");
        }
        Instant now = Instant.now();
        String id = UUID.randomUUID().toString();
        Leaderboard leaderboard = Leaderboard.builder()
            .id(id)
            .secret(newSecret())
            .name(name != null && !name.isBlank() ? name : "Leaderboard " + id)
            .ordering(ordering)
            .updatePolicy(updatePolicy)
            .status(LeaderboardStatus.ACTIVE)
            .createdAt(now)
            .updatedAt(now)
            .createdBy(createdBy != null ? createdBy : "system")
            .metadata(metadata)
            .build();

        Leaderboard saved = leaderboardRepository.save(leaderboard);
        cache.put(id, saved);
        logger.info("Provisioned leaderboard {} ({}, {})", id, ordering, updatePolicy);
        return saved;
    }

    public Leaderboard rotateSecret(String leaderboardId) {
        Leaderboard updated = update(leaderboardId, leaderboard -> {
            leaderboard.setSecret(newSecret());
            return leaderboard;
        });
        logger.info("Rotated secret of leaderboard {}", leaderboardId);
        return updated;
    }

    /**
     * Edits display metadata. Null arguments leave the field unchanged.
     */
    public Leaderboard updateMetadata(String leaderboardId, String name, Map<String, Object> metadata) {
        return update(leaderboardId, leaderboard -> {
            if (name != null && !name.isBlank()) {
                leaderboard.setName(name);
            }
            if (metadata != null) {
                leaderboard.setMetadata(metadata);
            }
            return leaderboard;
        });
    }

    /**
     * Marks the leaderboard deleted. Its scores are kept.
     */
    public Leaderboard softDelete(String leaderboardId) {
        Leaderboard deleted = update(leaderboardId, leaderboard -> {
            leaderboard.setStatus(LeaderboardStatus.DELETED);
            return leaderboard;
        });
        logger.info("Soft-deleted leaderboard {}", leaderboardId);
        return deleted;
    }

    private Leaderboard update(String leaderboardId, UnaryOperator<Leaderboard> change) {
        ReentrantLock lock = recordLocks.computeIfAbsent(leaderboardId, k -> new ReentrantLock());
        lock.lock();
        try {
            Leaderboard current = resolve(leaderboardId);
            Leaderboard updated = change.apply(current.toBuilder().build());
            updated.setUpdatedAt(Instant.now());
            Leaderboard saved = leaderboardRepository.save(updated);
            cache.put(leaderboardId, saved);
            return saved;
        } finally {
            lock.unlock();
        }
    }

    private static String newSecret() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
