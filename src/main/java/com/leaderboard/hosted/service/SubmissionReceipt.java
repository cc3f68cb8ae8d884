package com.leaderboard.hosted.service;

import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.policy.UpdateDecision;
import lombok.Builder;
import lombok.Value;

/**
 * Acknowledgement of a durable submission.
 */
@Value
@Builder
public class SubmissionReceipt {
    String leaderboardId;
    String playerId;
    String displayName;
    ScoreEntry submitted;
    /** The entry ranking the player once the submission was applied. */
    ScoreEntry current;
    UpdateDecision decision;
    /** Null when the index could not be read after the update. */
    RankedPlayer ranking;
    Long totalPlayers;

    public boolean isImproved() {
        return decision.changesCurrent();
    }
}
