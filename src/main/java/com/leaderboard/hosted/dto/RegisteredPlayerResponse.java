package com.leaderboard.hosted.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The only response that ever carries a player key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisteredPlayerResponse {
    private String leaderboardId;
    private String playerId;
    private String displayName;
    private String key;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;
}
