package com.leaderboard.hosted.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One submitted score. Entries are never modified after they are written,
 * apart from losing the {@code current} flag when a better one supersedes them
 * under {@link UpdatePolicy#KEEP_ALL}.
 */
@Entity
@Table(name = "score_entries", indexes = {
    @Index(name = "idx_score_entry_leaderboard_player", columnList = "leaderboard_id,player_id"),
    @Index(name = "idx_score_entry_leaderboard_current", columnList = "leaderboard_id,is_current")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScoreEntry {
    @Id
    @Column(name = "entry_id", nullable = false)
    private String id;

    @Column(name = "leaderboard_id", nullable = false)
    private String leaderboardId;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "score_value", nullable = false)
    private Double value;

    @Column(name = "submitted_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @Column(name = "metadata", length = 4096)
    private String metadata;

    @Column(name = "is_current", nullable = false)
    private boolean current;
}
