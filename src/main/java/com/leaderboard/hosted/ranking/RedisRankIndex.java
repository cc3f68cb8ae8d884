package com.leaderboard.hosted.ranking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreOrdering;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.resps.Tuple;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link RankIndex} kept in a Redis sorted set.
 *
 * <p>The sorted-set score is the value, negated for higher-is-better
 * leaderboards, so ascending rank order is always best first. Members are
 * {@code <19-digit zero-padded epoch millis>:<playerId>}; Redis orders equal
 * scores lexicographically by member, which yields the earliest-timestamp then
 * player-id tie-break exactly. A companion hash keyed by player id holds the
 * entry as JSON for display data and member lookup.
 */
public class RedisRankIndex implements RankIndex {

    private static final String KEY_PREFIX = "leaderboard:";

    private final JedisPool jedisPool;
    private final ObjectMapper objectMapper;
    private final ScoreOrdering ordering;
    private final String rankingKey;
    private final String entriesKey;

    public RedisRankIndex(JedisPool jedisPool, ObjectMapper objectMapper, String leaderboardId, ScoreOrdering ordering) {
        this.jedisPool = jedisPool;
        this.objectMapper = objectMapper;
        this.ordering = ordering;
        this.rankingKey = KEY_PREFIX + leaderboardId + ":ranking";
        this.entriesKey = KEY_PREFIX + leaderboardId + ":entries";
    }

    public static String member(IndexedScore score) {
        return String.format("%019d", score.getTimestamp().toEpochMilli()) + ":" + score.getPlayerId();
    }

    public static String playerIdOf(String member) {
        return member.substring(member.indexOf(':') + 1);
    }

    public static double sortScore(ScoreOrdering ordering, double value) {
        return ordering == ScoreOrdering.HIGHER_IS_BETTER ? -value : value;
    }

    @Override
    public void insertOrUpdate(IndexedScore previous, IndexedScore current) {
        String encoded = encode(current);
        try (Jedis jedis = jedisPool.getResource()) {
            String storedJson = jedis.hget(entriesKey, current.getPlayerId());
            IndexedScore stale = storedJson != null ? decode(storedJson) : previous;
            Transaction tx = jedis.multi();
            if (stale != null) {
                tx.zrem(rankingKey, member(stale));
            }
            tx.zadd(rankingKey, sortScore(ordering, current.getValue()), member(current));
            tx.hset(entriesKey, current.getPlayerId(), encoded);
            tx.exec();
        } catch (JedisException e) {
            throw new StorageUnavailableException("Failed to update rank index in Redis", e);
        }
    }

    @Override
    public List<RankedPlayer> top(int n) {
        if (n <= 0) {
            return Collections.emptyList();
        }
        try (Jedis jedis = jedisPool.getResource()) {
            return ranked(jedis, jedis.zrangeWithScores(rankingKey, 0, n - 1L), 0);
        } catch (JedisException e) {
            throw new StorageUnavailableException("Failed to read top entries from Redis", e);
        }
    }

    @Override
    public Optional<RankedPlayer> rankOf(String playerId) {
        try (Jedis jedis = jedisPool.getResource()) {
            Long rank = zeroBasedRank(jedis, playerId);
            if (rank == null) {
                return Optional.empty();
            }
            List<RankedPlayer> single = ranked(jedis, jedis.zrangeWithScores(rankingKey, rank, rank), rank);
            return single.stream().filter(p -> p.getPlayerId().equals(playerId)).findFirst();
        } catch (JedisException e) {
            throw new StorageUnavailableException("Failed to read player rank from Redis", e);
        }
    }

    @Override
    public List<RankedPlayer> around(String playerId, int window) {
        try (Jedis jedis = jedisPool.getResource()) {
            Long rank = zeroBasedRank(jedis, playerId);
            if (rank == null) {
                return Collections.emptyList();
            }
            long from = Math.max(0, rank - window);
            return ranked(jedis, jedis.zrangeWithScores(rankingKey, from, rank + window), from);
        } catch (JedisException e) {
            throw new StorageUnavailableException("Failed to read neighbouring entries from Redis", e);
        }
    }

    @Override
    public long size() {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.zcard(rankingKey);
        } catch (JedisException e) {
            throw new StorageUnavailableException("Failed to read rank index size from Redis", e);
        }
    }

    @Override
    public Optional<IndexedScore> entry(String playerId) {
        try (Jedis jedis = jedisPool.getResource()) {
            String json = jedis.hget(entriesKey, playerId);
            return json == null ? Optional.empty() : Optional.of(decode(json));
        } catch (JedisException e) {
            throw new StorageUnavailableException("Failed to read rank entry from Redis", e);
        }
    }

    @Override
    public Set<String> playerIds() {
        try (Jedis jedis = jedisPool.getResource()) {
            Set<String> ids = new HashSet<>();
            for (String member : jedis.zrange(rankingKey, 0, -1)) {
                ids.add(playerIdOf(member));
            }
            return ids;
        } catch (JedisException e) {
            throw new StorageUnavailableException("Failed to list ranked players from Redis", e);
        }
    }

    @Override
    public void rebuild(Collection<IndexedScore> entries) {
        Map<String, Double> members = new HashMap<>();
        Map<String, String> encoded = new HashMap<>();
        for (IndexedScore entry : entries) {
            String stale = encoded.put(entry.getPlayerId(), encode(entry));
            if (stale != null) {
                members.remove(member(decode(stale)));
            }
            members.put(member(entry), sortScore(ordering, entry.getValue()));
        }
        try (Jedis jedis = jedisPool.getResource()) {
            Transaction tx = jedis.multi();
            tx.del(rankingKey, entriesKey);
            if (!members.isEmpty()) {
                tx.zadd(rankingKey, members);
                tx.hset(entriesKey, encoded);
            }
            tx.exec();
        } catch (JedisException e) {
            throw new StorageUnavailableException("Failed to rebuild rank index in Redis", e);
        }
    }

    private Long zeroBasedRank(Jedis jedis, String playerId) {
        String json = jedis.hget(entriesKey, playerId);
        if (json == null) {
            return null;
        }
        return jedis.zrank(rankingKey, member(decode(json)));
    }

    private List<RankedPlayer> ranked(Jedis jedis, List<Tuple> tuples, long offset) {
        if (tuples.isEmpty()) {
            return Collections.emptyList();
        }
        String[] playerIds = tuples.stream().map(t -> playerIdOf(t.getElement())).toArray(String[]::new);
        List<String> details = jedis.hmget(entriesKey, playerIds);

        List<RankedPlayer> result = new ArrayList<>(tuples.size());
        for (int i = 0; i < tuples.size(); i++) {
            Tuple tuple = tuples.get(i);
            String json = details.get(i);
            IndexedScore detail = json != null ? decode(json) : null;
            result.add(RankedPlayer.builder()
                .playerId(playerIds[i])
                .displayName(detail != null ? detail.getDisplayName() : null)
                .score(sortScore(ordering, tuple.getScore()) + 0.0)
                .timestamp(detail != null ? detail.getTimestamp() : null)
                .metadata(detail != null ? detail.getMetadata() : null)
                .rank((int) (offset + i + 1))
                .build());
        }
        return result;
    }

    private String encode(IndexedScore score) {
        try {
            return objectMapper.writeValueAsString(StoredEntry.of(score));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Rank entry is not serializable", e);
        }
    }

    private IndexedScore decode(String json) {
        try {
            return objectMapper.readValue(json, StoredEntry.class).toIndexedScore();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt rank entry in " + entriesKey, e);
        }
    }
}
