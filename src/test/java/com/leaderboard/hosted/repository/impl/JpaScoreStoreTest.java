package com.leaderboard.hosted.repository.impl;

import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.LeaderboardStatus;
import com.leaderboard.hosted.model.ScoreEntry;
import com.leaderboard.hosted.model.ScoreOrdering;
import com.leaderboard.hosted.model.UpdatePolicy;
import com.leaderboard.hosted.policy.UpdateDecision;
import com.leaderboard.hosted.repository.PutResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaScoreStore.class)
class JpaScoreStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Autowired
    private JpaScoreStore store;

    private static Leaderboard leaderboard(String id, ScoreOrdering ordering, UpdatePolicy policy) {
        return Leaderboard.builder()
            .id(id)
            .secret("secret")
            .ordering(ordering)
            .updatePolicy(policy)
            .status(LeaderboardStatus.ACTIVE)
            .createdAt(T0)
            .build();
    }

    private static ScoreEntry candidate(String leaderboardId, String playerId, double value, long offsetMillis) {
        return ScoreEntry.builder()
            .leaderboardId(leaderboardId)
            .playerId(playerId)
            .value(value)
            .timestamp(T0.plusMillis(offsetMillis))
            .build();
    }

    @Test
    void testKeepBestLowerIsBetter() {
        Leaderboard leaderboard = leaderboard("lb-speedrun", ScoreOrdering.LOWER_IS_BETTER, UpdatePolicy.KEEP_BEST);

        store.put(leaderboard, candidate("lb-speedrun", "alice", 61.2, 0));
        PutResult worse = store.put(leaderboard, candidate("lb-speedrun", "alice", 70.0, 1));
        PutResult better = store.put(leaderboard, candidate("lb-speedrun", "alice", 58.9, 2));

        assertEquals(UpdateDecision.RETAIN, worse.getDecision());
        assertEquals(UpdateDecision.REPLACE, better.getDecision());
        assertEquals(61.2, better.getPrevious().getValue());
        assertEquals(58.9, store.getCurrent("lb-speedrun", "alice").orElseThrow().getValue());
        assertEquals(1, store.history("lb-speedrun", "alice").size());
    }

    @Test
    void testKeepAllKeepsHistoryOldestFirst() {
        Leaderboard leaderboard = leaderboard("lb-all", ScoreOrdering.HIGHER_IS_BETTER, UpdatePolicy.KEEP_ALL);

        store.put(leaderboard, candidate("lb-all", "bob", 10, 0));
        store.put(leaderboard, candidate("lb-all", "bob", 30, 1));
        PutResult appended = store.put(leaderboard, candidate("lb-all", "bob", 20, 2));

        assertEquals(UpdateDecision.APPEND, appended.getDecision());
        assertEquals(30.0, appended.getCurrent().getValue());
        List<Double> history = store.history("lb-all", "bob").stream()
            .map(ScoreEntry::getValue)
            .collect(Collectors.toList());
        assertEquals(List.of(10.0, 30.0, 20.0), history);
    }

    @Test
    void testCurrentEntriesHoldOnePerPlayer() {
        Leaderboard leaderboard = leaderboard("lb-proj", ScoreOrdering.HIGHER_IS_BETTER, UpdatePolicy.KEEP_ALL);

        store.put(leaderboard, candidate("lb-proj", "alice", 1, 0));
        store.put(leaderboard, candidate("lb-proj", "alice", 2, 1));
        store.put(leaderboard, candidate("lb-proj", "bob", 5, 2));

        List<ScoreEntry> current = store.currentEntries("lb-proj");
        assertEquals(2, current.size());
        assertTrue(current.stream().allMatch(ScoreEntry::isCurrent));
        assertTrue(store.currentEntries("lb-other").isEmpty());
    }
}
