package com.leaderboard.hosted.ranking;

import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A player's current entry as held by a {@link RankIndex}.
 */
@Value
@Builder(toBuilder = true)
public class IndexedScore {
    String playerId;
    String displayName;
    double value;
    Instant timestamp;
    String metadata;

    public static IndexedScore of(ScoreEntry entry, String displayName) {
        return IndexedScore.builder()
            .playerId(entry.getPlayerId())
            .displayName(displayName)
            .value(entry.getValue())
            .timestamp(entry.getTimestamp())
            .metadata(entry.getMetadata())
            .build();
    }

    public RankedPlayer toRankedPlayer(int rank) {
        return RankedPlayer.builder()
            .playerId(playerId)
            .displayName(displayName)
            .score(value)
            .timestamp(timestamp)
            .metadata(metadata)
            .rank(rank)
            .build();
    }

    /**
     * True when both describe the same rank position, ignoring display data.
     */
    public boolean sameRankKey(IndexedScore other) {
        return other != null
            && playerId.equals(other.playerId)
            && Double.compare(value, other.value) == 0
            && timestamp.equals(other.timestamp);
    }
}
