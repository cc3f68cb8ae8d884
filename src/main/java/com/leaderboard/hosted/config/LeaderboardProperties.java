package com.leaderboard.hosted.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings under the {@code leaderboard} prefix.
 */
@Component
@ConfigurationProperties(prefix = "leaderboard")
@Data
public class LeaderboardProperties {

    private Storage storage = new Storage();
    private RankIndex rankIndex = new RankIndex();
    private Retry retry = new Retry();
    private Query query = new Query();
    private Submission submission = new Submission();
    private Admin admin = new Admin();

    @Data
    public static class Storage {
        /**
         * {@code jpa} or {@code json}
         */
        private String type = "jpa";

        /**
         * Root directory of the JSON file store
         */
        private String directory = "./data";
    }

    @Data
    public static class RankIndex {
        /**
         * {@code memory} or {@code redis}
         */
        private String type = "memory";

        /**
         * Delay between runs of the consistency verifier
         */
        private long verifyIntervalMs = 30000;

        /**
         * Compare every loaded index with the score store on each verifier run
         */
        private boolean auditEnabled = false;

        /**
         * Build the index of every active leaderboard when the application starts
         */
        private boolean warmOnStartup = true;
    }

    @Data
    public static class Retry {
        /**
         * Attempts per storage operation, including the first one
         */
        private int maxAttempts = 4;

        /**
         * Base delay in milliseconds for exponential backoff
         */
        private long baseDelayMs = 50;

        /**
         * Maximum delay in milliseconds (cap for exponential backoff)
         */
        private long maxDelayMs = 2000;

        /**
         * Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation)
         */
        private double jitterFactor = 0.25;
    }

    @Data
    public static class Query {
        private int defaultLimit = 10;
        private int maxLimit = 1000;
        private int defaultWindow = 5;
        private int maxWindow = 100;

        /**
         * Require the leaderboard key on read endpoints
         */
        private boolean requireKey = false;
    }

    @Data
    public static class Submission {
        private int maxPlayerIdLength = 128;
        private int maxDisplayNameLength = 64;
        private int maxMetadataLength = 4096;

        /**
         * Accepted distance between a signed submission's timestamp and the server clock
         */
        private long signatureMaxSkewMs = 300000;

        private int workerThreads = 8;
        private int queueCapacity = 1000;
    }

    @Data
    public static class Admin {
        /**
         * Bearer token for the admin API; the API rejects every call while unset
         */
        private String token;
    }
}
