package com.leaderboard.hosted.service;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.exception.AuthenticationFailedException;
import com.leaderboard.hosted.exception.IndexUnavailableException;
import com.leaderboard.hosted.exception.InvalidRequestException;
import com.leaderboard.hosted.exception.PlayerNotRankedException;
import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.LeaderboardStatus;
import com.leaderboard.hosted.model.RankedPlayer;
import com.leaderboard.hosted.model.ScoreOrdering;
import com.leaderboard.hosted.model.UpdatePolicy;
import com.leaderboard.hosted.ranking.RankIndex;
import com.leaderboard.hosted.repository.ScoreStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardQueryServiceTest {

    @Mock
    private LeaderboardRegistry leaderboardRegistry;

    @Mock
    private RankIndexRegistry rankIndexRegistry;

    @Mock
    private ScoreStore scoreStore;

    @Mock
    private RankIndex rankIndex;

    private LeaderboardProperties properties;
    private LeaderboardQueryService queryService;
    private Leaderboard testLeaderboard;

    @BeforeEach
    void setUp() {
        properties = new LeaderboardProperties();
        queryService = new LeaderboardQueryService(leaderboardRegistry, rankIndexRegistry, scoreStore,
            new StorageRetrier(properties), properties);
        testLeaderboard = Leaderboard.builder()
            .id("lb-1")
            .secret("secret")
            .ordering(ScoreOrdering.HIGHER_IS_BETTER)
            .updatePolicy(UpdatePolicy.KEEP_BEST)
            .status(LeaderboardStatus.ACTIVE)
            .build();
    }

    @Test
    void testTop_ReadsFromRankIndex() {
        // Arrange
        List<RankedPlayer> ranked = List.of(RankedPlayer.builder().playerId("bob").rank(1).score(250.0).build());
        when(leaderboardRegistry.resolve("lb-1")).thenReturn(testLeaderboard);
        when(rankIndexRegistry.indexFor(testLeaderboard)).thenReturn(rankIndex);
        when(rankIndex.top(10)).thenReturn(ranked);

        // Act
        List<RankedPlayer> result = queryService.top("lb-1", 10, null);

        // Assert
        assertEquals(ranked, result);
        verifyNoInteractions(scoreStore);
    }

    @Test
    void testTop_RejectsOutOfRangeLimit() {
        assertThrows(InvalidRequestException.class, () -> queryService.top("lb-1", 0, null));
        assertThrows(InvalidRequestException.class,
            () -> queryService.top("lb-1", properties.getQuery().getMaxLimit() + 1, null));
        verifyNoInteractions(leaderboardRegistry);
    }

    @Test
    void testRankOf_UnrankedPlayer() {
        when(leaderboardRegistry.resolve("lb-1")).thenReturn(testLeaderboard);
        when(rankIndexRegistry.indexFor(testLeaderboard)).thenReturn(rankIndex);
        when(rankIndex.rankOf("ghost")).thenReturn(Optional.empty());

        assertThrows(PlayerNotRankedException.class, () -> queryService.rankOf("lb-1", "ghost", null));
    }

    @Test
    void testAround_ValidatesWindowAndRanking() {
        when(leaderboardRegistry.resolve("lb-1")).thenReturn(testLeaderboard);
        when(rankIndexRegistry.indexFor(testLeaderboard)).thenReturn(rankIndex);
        when(rankIndex.around("ghost", 3)).thenReturn(List.of());

        assertThrows(InvalidRequestException.class, () -> queryService.around("lb-1", "ghost", -1, null));
        assertThrows(PlayerNotRankedException.class, () -> queryService.around("lb-1", "ghost", 3, null));
    }

    @Test
    void testIndexReadFailureIsReportedAsUnavailable() {
        when(leaderboardRegistry.resolve("lb-1")).thenReturn(testLeaderboard);
        when(rankIndexRegistry.indexFor(testLeaderboard)).thenReturn(rankIndex);
        when(rankIndex.size()).thenThrow(new StorageUnavailableException("redis down", null));

        assertThrows(IndexUnavailableException.class, () -> queryService.totalPlayers("lb-1", null));
    }

    @Test
    void testRequireKey() {
        // Arrange
        properties.getQuery().setRequireKey(true);
        when(leaderboardRegistry.resolve("lb-1")).thenReturn(testLeaderboard);
        when(rankIndexRegistry.indexFor(testLeaderboard)).thenReturn(rankIndex);
        when(rankIndex.size()).thenReturn(4L);

        // Act & Assert
        assertThrows(AuthenticationFailedException.class, () -> queryService.totalPlayers("lb-1", null));
        assertThrows(AuthenticationFailedException.class, () -> queryService.totalPlayers("lb-1", "wrong"));
        assertEquals(4L, queryService.totalPlayers("lb-1", "secret"));
    }
}
