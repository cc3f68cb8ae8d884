package com.leaderboard.hosted.ranking;

import com.leaderboard.hosted.model.Leaderboard;

/**
 * Creates the rank index backing one leaderboard.
 */
public interface RankIndexFactory {
    RankIndex create(Leaderboard leaderboard);

    /**
     * Whether indexes from this factory survive a process restart. Volatile
     * indexes are always rebuilt on first use; durable ones are audited first.
     */
    boolean isDurable();
}
