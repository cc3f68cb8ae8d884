package com.leaderboard.hosted.ranking;

import com.leaderboard.hosted.model.ScoreOrdering;

import java.util.Comparator;

/**
 * Total order used for ranking: value under the leaderboard's ordering, then
 * earliest timestamp, then player id by code point. Code point order is the
 * byte order of UTF-8, which is how Redis compares sorted-set members.
 */
public final class RankOrder {

    private RankOrder() {
    }

    public static Comparator<IndexedScore> of(ScoreOrdering ordering) {
        return (a, b) -> {
            int byValue = ordering.compareValues(a.getValue(), b.getValue());
            if (byValue != 0) {
                return byValue;
            }
            int byTime = a.getTimestamp().compareTo(b.getTimestamp());
            if (byTime != 0) {
                return byTime;
            }
            return compareCodePoints(a.getPlayerId(), b.getPlayerId());
        };
    }

    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
