package com.leaderboard.hosted.ranking;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JSON form of an {@link IndexedScore} in the Redis entries hash.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
class StoredEntry {
    private String playerId;
    private String displayName;
    private double value;
    private Instant timestamp;
    private String metadata;

    static StoredEntry of(IndexedScore score) {
        return new StoredEntry(score.getPlayerId(), score.getDisplayName(), score.getValue(),
            score.getTimestamp(), score.getMetadata());
    }

    IndexedScore toIndexedScore() {
        return IndexedScore.builder()
            .playerId(playerId)
            .displayName(displayName)
            .value(value)
            .timestamp(timestamp)
            .metadata(metadata)
            .build();
    }
}
