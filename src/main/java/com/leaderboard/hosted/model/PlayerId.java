package com.leaderboard.hosted.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerId implements Serializable {
    private String leaderboardId;
    private String playerId;
}
