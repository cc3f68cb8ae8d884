package com.leaderboard.hosted.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A score submission. Carries either the leaderboard {@code key} or a
 * player signature {@code k}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreSubmissionRequest {
    private String key;

    @JsonProperty("k")
    private String signature;

    @NotBlank(message = "Player id cannot be blank")
    private String playerId;

    private String displayName;

    @NotNull(message = "Score cannot be null")
    private Double score;

    @JsonProperty("meta")
    private String metadata;

    /**
     * Epoch milliseconds; the server clock when absent.
     */
    private Long timestamp;
}
