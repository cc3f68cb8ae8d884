package com.leaderboard.hosted.repository;

import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.ScoreEntry;

import java.util.List;
import java.util.Optional;

/**
 * Durable score history per {@code (leaderboard, player)}.
 *
 * <p>{@link #put} applies the leaderboard's update policy and returns only
 * after the outcome is durable. Implementations throw
 * {@link com.leaderboard.hosted.exception.StorageUnavailableException} for
 * transient failures, in which case nothing was written.
 */
public interface ScoreStore {

    PutResult put(Leaderboard leaderboard, ScoreEntry candidate);

    Optional<ScoreEntry> getCurrent(String leaderboardId, String playerId);

    /**
     * Retained entries, oldest first. Under policies other than KEEP_ALL this
     * is at most the current entry.
     */
    List<ScoreEntry> history(String leaderboardId, String playerId);

    /**
     * The current entry of every player; the projection the rank index is
     * rebuilt from.
     */
    List<ScoreEntry> currentEntries(String leaderboardId);
}
