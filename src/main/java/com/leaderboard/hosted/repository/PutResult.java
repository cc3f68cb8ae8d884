package com.leaderboard.hosted.repository;

import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.policy.UpdateDecision;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PutResult {
    /** Current entry before the put; null for a first submission. */
    ScoreEntry previous;
    /** Current entry after the put. */
    ScoreEntry current;
    UpdateDecision decision;

    public boolean currentChanged() {
        return decision.changesCurrent();
    }
}
