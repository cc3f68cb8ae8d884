package com.leaderboard.hosted.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Editable leaderboard fields; absent fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateLeaderboardRequest {
    @Size(max = 255, message = "Name is too long")
    private String name;

    private Map<String, Object> metadata;
}
