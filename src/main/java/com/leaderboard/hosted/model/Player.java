package com.leaderboard.hosted.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "players")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@IdClass(PlayerId.class)
public class Player {
    @Id
    @Column(name = "leaderboard_id", nullable = false)
    private String leaderboardId;

    @Id
    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "display_name")
    private String displayName;

    // Only set for players registered explicitly; used to verify signed submissions.
    @Column(name = "player_key")
    private String playerKey;

    @Column(name = "created_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;
}
