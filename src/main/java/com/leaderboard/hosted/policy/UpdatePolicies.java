package com.leaderboard.hosted.policy;

import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.model.ScoreOrdering;
import com.leaderboard.hosted.model.UpdatePolicy;

/**
 * Decides what a submission does to a player's entries. Pure: depends only on
 * its arguments.
 */
public final class UpdatePolicies {

    private UpdatePolicies() {
    }

    /**
     * @param current the player's current entry, or null for a first submission
     */
    public static UpdateDecision decide(UpdatePolicy policy, ScoreOrdering ordering,
                                        ScoreEntry current, ScoreEntry candidate) {
        switch (policy) {
            case KEEP_BEST:
                if (current == null || ordering.isStrictlyBetter(candidate.getValue(), current.getValue())) {
                    return UpdateDecision.REPLACE;
                }
                return UpdateDecision.RETAIN;
            case KEEP_LATEST:
                return UpdateDecision.REPLACE;
            case KEEP_ALL:
                if (current == null || outranks(ordering, candidate, current)) {
                    return UpdateDecision.APPEND_AS_CURRENT;
                }
                return UpdateDecision.APPEND;
            default:
                throw new IllegalArgumentException("Unknown update policy: " + policy);
        }
    }

    // Better value, or equal value submitted earlier.
    private static boolean outranks(ScoreOrdering ordering, ScoreEntry candidate, ScoreEntry current) {
        int byValue = ordering.compareValues(candidate.getValue(), current.getValue());
        if (byValue != 0) {
            return byValue < 0;
        }
        return candidate.getTimestamp().isBefore(current.getTimestamp());
    }
}
