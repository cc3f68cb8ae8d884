package com.leaderboard.hosted.ranking;

import com.leaderboard.hosted.model.Leaderboard;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "leaderboard.rank-index.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRankIndexFactory implements RankIndexFactory {

    @Override
    public RankIndex create(Leaderboard leaderboard) {
        return new InMemoryRankIndex(leaderboard.getId(), leaderboard.getOrdering());
    }

    @Override
    public boolean isDurable() {
        return false;
    }
}
