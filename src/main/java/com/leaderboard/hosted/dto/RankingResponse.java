package com.leaderboard.hosted.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.leaderboard.hosted.model.RankedPlayer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankingResponse {
    private String leaderboardId;
    private List<RankedPlayer> players;
    private Long totalPlayers;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}
