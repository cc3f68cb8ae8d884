package com.leaderboard.hosted.dto;

import com.leaderboard.hosted.model.ScoreEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreHistoryResponse {
    private String leaderboardId;
    private String playerId;
    private List<ScoreEntry> entries;
}
