package com.leaderboard.hosted.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterPlayerRequest {
    /** Generated when absent. */
    private String displayName;
}
