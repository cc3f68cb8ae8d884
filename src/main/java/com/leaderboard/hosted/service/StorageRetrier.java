package com.leaderboard.hosted.service;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Retries storage calls that fail with {@link StorageUnavailableException},
 * using capped exponential backoff with jitter. Other exceptions pass through
 * on the first attempt.
 *
 * <p>Backoff sleeps are not interruptible: an interrupt received while waiting
 * is restored once the call completes.
 */
@Component
public class StorageRetrier {

    private static final Logger logger = LoggerFactory.getLogger(StorageRetrier.class);

    private final LeaderboardProperties.Retry config;

    public StorageRetrier(LeaderboardProperties properties) {
        this.config = properties.getRetry();
    }

    public <T> T call(String operation, Supplier<T> action) {
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        for (int attempt = 0; ; attempt++) {
            try {
                return action.get();
            } catch (StorageUnavailableException e) {
                if (attempt + 1 >= maxAttempts) {
                    logger.error("{} failed after {} attempts", operation, maxAttempts, e);
                    throw e;
                }
                long delay = calculateBackoffDelay(attempt);
                logger.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                    operation, attempt + 1, maxAttempts, delay, e.getMessage());
                sleepUninterruptibly(delay);
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Calculate exponential backoff delay with jitter
     */
    public long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = config.getBaseDelayMs() * (1L << Math.min(retryCount, 30));
        double jitterRange = config.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (ThreadLocalRandom.current().nextDouble() * 2 * jitterRange);
        long delayWithJitter = (long) (exponentialDelay * jitter);
        return Math.min(delayWithJitter, config.getMaxDelayMs());
    }

    protected void sleepUninterruptibly(long delayMs) {
        boolean interrupted = false;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs);
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return;
                }
                try {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
