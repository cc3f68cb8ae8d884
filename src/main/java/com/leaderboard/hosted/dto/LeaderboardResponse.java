package com.leaderboard.hosted.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.LeaderboardStatus;
import com.leaderboard.hosted.model.ScoreOrdering;
import com.leaderboard.hosted.model.UpdatePolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Admin view of a leaderboard. The secret is only included right after it
 * was issued.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LeaderboardResponse {
    private String id;
    private String secret;
    private String name;
    private ScoreOrdering ordering;
    private UpdatePolicy updatePolicy;
    private LeaderboardStatus status;
    private String createdBy;
    private Map<String, Object> metadata;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    public static LeaderboardResponse from(Leaderboard leaderboard, boolean includeSecret) {
        return LeaderboardResponse.builder()
            .id(leaderboard.getId())
            .secret(includeSecret ? leaderboard.getSecret() : null)
            .name(leaderboard.getName())
            .ordering(leaderboard.getOrdering())
            .updatePolicy(leaderboard.getUpdatePolicy())
            .status(leaderboard.getStatus())
            .createdBy(leaderboard.getCreatedBy())
            .metadata(leaderboard.getMetadata())
            .createdAt(leaderboard.getCreatedAt())
            .updatedAt(leaderboard.getUpdatedAt())
            .build();
    }
}
