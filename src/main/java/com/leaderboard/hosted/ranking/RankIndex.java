package com.leaderboard.hosted.ranking;

import com.leaderboard.hosted.model.RankedPlayer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rank-ordered view of one leaderboard's current entries.
 *
 * <p>Ranks are 1-based and distinct: equal values are separated by earliest
 * timestamp, then by player id. Every read observes either the state before or
 * after any single {@link #insertOrUpdate}, never a partial one.
 */
public interface RankIndex {

    /**
     * Replaces the player's indexed entry with {@code current}. {@code previous}
     * is the entry the caller believes is indexed and may be null; the index's
     * own record of the player takes precedence when they differ.
     */
    void insertOrUpdate(IndexedScore previous, IndexedScore current);

    List<RankedPlayer> top(int n);

    Optional<RankedPlayer> rankOf(String playerId);

    /**
     * Up to {@code window} entries on each side of the player, plus the player.
     * Empty when the player is not ranked.
     */
    List<RankedPlayer> around(String playerId, int window);

    long size();

    Optional<IndexedScore> entry(String playerId);

    Set<String> playerIds();

    /**
     * Discards the current contents and indexes exactly {@code entries}.
     */
    void rebuild(Collection<IndexedScore> entries);
}
