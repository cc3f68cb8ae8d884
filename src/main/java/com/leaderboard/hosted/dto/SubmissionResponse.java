package com.leaderboard.hosted.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubmissionResponse {
    private String leaderboardId;
    private String playerId;
    private String displayName;
    private Double submittedScore;

    /** The entry that ranks the player after this submission. */
    private Double currentScore;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant currentTimestamp;

    /** False when the update policy retained an earlier entry. */
    private boolean improved;
    private String decision;
    private Integer rank;
    private Long totalPlayers;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant acknowledgedAt;
}
