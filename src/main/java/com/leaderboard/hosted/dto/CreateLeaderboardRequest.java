package com.leaderboard.hosted.dto;

import com.leaderboard.hosted.model.ScoreOrdering;
import com.leaderboard.hosted.model.UpdatePolicy;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateLeaderboardRequest {
    @Size(max = 255, message = "Name is too long")
    private String name;

    @NotNull(message = "Ordering is required")
    private ScoreOrdering ordering;

    @NotNull(message = "Update policy is required")
    private UpdatePolicy updatePolicy;

    private String createdBy;
    private Map<String, Object> metadata;
}
