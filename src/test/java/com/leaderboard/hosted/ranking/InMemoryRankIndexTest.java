package com.leaderboard.hosted.ranking;

import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreOrdering;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRankIndexTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static IndexedScore score(String playerId, double value, long offsetMillis) {
        return IndexedScore.builder()
            .playerId(playerId)
            .displayName(playerId.toUpperCase())
            .value(value)
            .timestamp(T0.plusMillis(offsetMillis))
            .build();
    }

    private static List<String> ids(List<RankedPlayer> players) {
        return players.stream().map(RankedPlayer::getPlayerId).collect(Collectors.toList());
    }

    @Test
    void testTopOrdersHigherIsBetter() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);
        index.insertOrUpdate(null, score("alice", 100, 0));
        index.insertOrUpdate(null, score("bob", 250, 1));
        index.insertOrUpdate(null, score("carol", 175, 2));

        List<RankedPlayer> top = index.top(10);

        assertEquals(List.of("bob", "carol", "alice"), ids(top));
        assertEquals(List.of(1, 2, 3), top.stream().map(RankedPlayer::getRank).collect(Collectors.toList()));
        assertEquals("BOB", top.get(0).getDisplayName());
    }

    @Test
    void testTopOrdersLowerIsBetter() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.LOWER_IS_BETTER);
        index.insertOrUpdate(null, score("alice", 31.5, 0));
        index.insertOrUpdate(null, score("bob", 29.0, 1));

        assertEquals(List.of("bob", "alice"), ids(index.top(5)));
    }

    @Test
    void testTiesBrokenByEarliestTimestampThenPlayerId() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);
        index.insertOrUpdate(null, score("zed", 100, 5));
        index.insertOrUpdate(null, score("bob", 100, 10));
        index.insertOrUpdate(null, score("amy", 100, 10));

        List<RankedPlayer> top = index.top(3);

        assertEquals(List.of("zed", "amy", "bob"), ids(top));
        assertEquals(List.of(1, 2, 3), top.stream().map(RankedPlayer::getRank).collect(Collectors.toList()));
    }

    @Test
    void testUpdateMovesPlayerWithoutDuplicating() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);
        IndexedScore first = score("alice", 10, 0);
        index.insertOrUpdate(null, first);
        index.insertOrUpdate(null, score("bob", 20, 1));

        index.insertOrUpdate(first, score("alice", 30, 2));

        assertEquals(2, index.size());
        assertEquals(1, index.rankOf("alice").orElseThrow().getRank());
        assertEquals(30.0, index.entry("alice").orElseThrow().getValue());
    }

    @Test
    void testOwnRecordWinsOverStalePreviousArgument() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);
        index.insertOrUpdate(null, score("alice", 10, 0));

        index.insertOrUpdate(score("alice", 999, 99), score("alice", 15, 1));

        assertEquals(1, index.size());
        assertEquals(15.0, index.top(1).get(0).getScore());
    }

    @Test
    void testTopIsPrefixOfLargerTop() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);
        for (int p = 0; p < 30; p++) {
            index.insertOrUpdate(null, score("p" + p, p % 5, p % 3));
        }

        for (int n = 0; n < 30; n++) {
            List<RankedPlayer> shorter = index.top(n);
            List<RankedPlayer> longer = index.top(n + 1);
            assertEquals(n, shorter.size());
            assertEquals(shorter, longer.subList(0, n));
            assertEquals(n + 1, longer.get(n).getRank());
        }
    }

    @Test
    void testRankOfUnknownPlayerIsEmpty() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);

        assertTrue(index.rankOf("nobody").isEmpty());
        assertTrue(index.around("nobody", 3).isEmpty());
    }

    @Test
    void testAroundReturnsWindowOnEachSide() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);
        for (int i = 0; i < 10; i++) {
            index.insertOrUpdate(null, score("p" + i, 100 - i, i));
        }

        List<RankedPlayer> middle = index.around("p5", 2);
        List<RankedPlayer> edge = index.around("p0", 2);

        assertEquals(List.of("p3", "p4", "p5", "p6", "p7"), ids(middle));
        assertEquals(4, middle.get(0).getRank());
        assertEquals(List.of("p0", "p1", "p2"), ids(edge));
    }

    @Test
    void testRebuildReplacesContents() {
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);
        index.insertOrUpdate(null, score("stale", 1, 0));

        index.rebuild(List.of(score("a", 5, 0), score("b", 7, 1)));

        assertEquals(2, index.size());
        assertFalse(index.playerIds().contains("stale"));
        assertEquals(List.of("b", "a"), ids(index.top(10)));
    }

    @Test
    void testConcurrentReadersNeverSeeDuplicatesOrGaps() throws Exception {
        // Arrange
        InMemoryRankIndex index = new InMemoryRankIndex("lb", ScoreOrdering.HIGHER_IS_BETTER);
        int players = 50;
        for (int i = 0; i < players; i++) {
            index.insertOrUpdate(null, score("p" + i, i, i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(6);
        AtomicBoolean done = new AtomicBoolean();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // Act
        for (int w = 0; w < 3; w++) {
            int writer = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int round = 0; round < 500; round++) {
                    String playerId = "p" + ((round * 7 + writer) % players);
                    index.insertOrUpdate(null, score(playerId, round % 97, round));
                }
                return null;
            }));
        }
        for (int r = 0; r < 3; r++) {
            futures.add(pool.submit(() -> {
                start.await();
                while (!done.get()) {
                    List<RankedPlayer> top = index.top(players);
                    assertEquals(players, top.size());
                    assertEquals(players, top.stream().map(RankedPlayer::getPlayerId).distinct().count());
                    for (int i = 0; i < top.size(); i++) {
                        assertEquals(i + 1, top.get(i).getRank());
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (int w = 0; w < 3; w++) {
            futures.get(w).get(30, TimeUnit.SECONDS);
        }
        done.set(true);
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Assert
        assertEquals(players, index.size());
    }
}
