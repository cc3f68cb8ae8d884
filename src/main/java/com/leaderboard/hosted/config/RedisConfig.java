package com.leaderboard.hosted.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

@Configuration
@ConditionalOnProperty(name = "leaderboard.rank-index.type", havingValue = "redis")
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    @Bean(destroyMethod = "close")
    public JedisPool jedisPool() {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(128);
        poolConfig.setMaxIdle(32);
        poolConfig.setMinIdle(8);
        poolConfig.setTestOnBorrow(true);

        DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeout)
            .socketTimeoutMillis(timeout)
            .ssl(redisSsl);
        if (redisPassword != null && !redisPassword.isEmpty()) {
            clientConfigBuilder.password(redisPassword);
        }

        JedisPool pool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());
        try (Jedis jedis = pool.getResource()) {
            jedis.ping();
            logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
        } catch (JedisException e) {
            // Indexes are rebuilt from the score store once Redis comes back.
            logger.warn("Redis at {}:{} is not reachable yet: {}", redisHost, redisPort, e.getMessage());
        }
        return pool;
    }
}
