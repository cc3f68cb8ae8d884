package com.leaderboard.hosted.ranking;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.leaderboard.hosted.model.Leaderboard;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import redis.clients.jedis.JedisPool;

@Component
@ConditionalOnProperty(name = "leaderboard.rank-index.type", havingValue = "redis")
public class RedisRankIndexFactory implements RankIndexFactory {

    private final JedisPool jedisPool;
    private final ObjectMapper objectMapper;

    public RedisRankIndexFactory(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public RankIndex create(Leaderboard leaderboard) {
        return new RedisRankIndex(jedisPool, objectMapper, leaderboard.getId(), leaderboard.getOrdering());
    }

    @Override
    public boolean isDurable() {
        return true;
    }
}
