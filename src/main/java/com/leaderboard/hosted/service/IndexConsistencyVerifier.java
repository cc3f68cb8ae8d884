package com.leaderboard.hosted.service;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.exception.LeaderboardException;
import com.leaderboard.hosted.model.Leaderboard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class IndexConsistencyVerifier {

    private static final Logger logger = LoggerFactory.getLogger(IndexConsistencyVerifier.class);

    private final LeaderboardRegistry leaderboardRegistry;
    private final RankIndexRegistry rankIndexRegistry;
    private final LeaderboardProperties.RankIndex config;

    @Autowired
    public IndexConsistencyVerifier(LeaderboardRegistry leaderboardRegistry,
                                    RankIndexRegistry rankIndexRegistry,
                                    LeaderboardProperties properties) {
        this.leaderboardRegistry = leaderboardRegistry;
        this.rankIndexRegistry = rankIndexRegistry;
        this.config = properties.getRankIndex();
    }

    /**
     * Load the index of every active leaderboard before traffic arrives.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        if (!config.isWarmOnStartup()) {
            return;
        }
        try {
            for (Leaderboard leaderboard : leaderboardRegistry.activeLeaderboards()) {
                try {
                    rankIndexRegistry.indexFor(leaderboard);
                } catch (LeaderboardException e) {
                    logger.warn("Could not load rank index of leaderboard {}: {}", leaderboard.getId(), e.getMessage());
                }
            }
        } catch (Exception e) {
            logger.error("Error warming rank indexes", e);
        }
    }

    /**
     * Recover stale indexes, and audit the healthy ones when enabled.
     */
    @Scheduled(fixedDelayString = "${leaderboard.rank-index.verify-interval-ms:30000}")
    public void verifyIndexes() {
        try {
            int recovered = rankIndexRegistry.rebuildStale();
            if (recovered > 0) {
                logger.info("Recovered {} stale rank indexes", recovered);
            }
            if (config.isAuditEnabled()) {
                int rebuilt = rankIndexRegistry.auditAll();
                if (rebuilt > 0) {
                    logger.warn("Audit rebuilt {} inconsistent rank indexes", rebuilt);
                }
            }
        } catch (Exception e) {
            logger.error("Error verifying rank indexes", e);
        }
    }
}
