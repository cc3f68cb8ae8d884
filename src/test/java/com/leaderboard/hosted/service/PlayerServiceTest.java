package com.leaderboard.hosted.service;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.exception.InvalidRequestException;
import com.leaderboard.hosted.exception.LeaderboardNotFoundException;
import com.leaderboard.hosted.exception.StorageUnavailableException;
import com.leaderboard.hosted.exception.SubmissionFailedException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.Player;
import com.leaderboard.hosted.repository.PlayerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlayerServiceTest {

    @Mock
    private LeaderboardRegistry leaderboardRegistry;

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private PlayerNameGenerator nameGenerator;

    private PlayerService playerService;

    @BeforeEach
    void setUp() {
        LeaderboardProperties properties = new LeaderboardProperties();
        StorageRetrier retrier = new StorageRetrier(properties) {
            @Override
            protected void sleepUninterruptibly(long delayMs) {
            }
        };
        playerService = new PlayerService(leaderboardRegistry, playerRepository, nameGenerator, retrier, properties);
    }

    @Test
    void testRegister_IssuesIdAndKey() {
        // Arrange
        when(leaderboardRegistry.resolve("lb-1")).thenReturn(Leaderboard.builder().id("lb-1").build());
        when(playerRepository.save(any(Player.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        Player player = playerService.register("lb-1", "Alice");

        // Assert
        assertEquals("lb-1", player.getLeaderboardId());
        assertEquals("Alice", player.getDisplayName());
        assertNotNull(player.getPlayerId());
        assertNotNull(player.getPlayerKey());
        assertNotEquals(player.getPlayerId(), player.getPlayerKey());
        verifyNoInteractions(nameGenerator);
    }

    @Test
    void testRegister_GeneratesNameWhenBlank() {
        // Arrange
        when(leaderboardRegistry.resolve("lb-1")).thenReturn(Leaderboard.builder().id("lb-1").build());
        when(nameGenerator.generate()).thenReturn("SwiftOtter512");
        when(playerRepository.save(any(Player.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        Player player = playerService.register("lb-1", " ");

        // Assert
        assertEquals("SwiftOtter512", player.getDisplayName());
    }

    @Test
    void testRegister_NameTooLong() {
        String name = "x".repeat(65);

        assertThrows(InvalidRequestException.class, () -> playerService.register("lb-1", name));
        verifyNoInteractions(leaderboardRegistry, playerRepository);
    }

    @Test
    void testRegister_UnknownLeaderboard() {
        when(leaderboardRegistry.resolve("nope")).thenThrow(new LeaderboardNotFoundException("Leaderboard not found: nope"));

        assertThrows(LeaderboardNotFoundException.class, () -> playerService.register("nope", "Alice"));
        verifyNoInteractions(playerRepository);
    }

    @Test
    void testRegister_StoreUnavailable() {
        // Arrange
        when(leaderboardRegistry.resolve("lb-1")).thenReturn(Leaderboard.builder().id("lb-1").build());
        when(playerRepository.save(any(Player.class))).thenThrow(new StorageUnavailableException("down", null));

        // Act
        SubmissionFailedException ex = assertThrows(SubmissionFailedException.class,
            () -> playerService.register("lb-1", "Alice"));

        // Assert
        assertFalse(ex.isPersisted());
        assertEquals(SubmissionStage.PERSISTING, ex.getStage());
        verify(playerRepository, times(new LeaderboardProperties().getRetry().getMaxAttempts())).save(any(Player.class));
    }
}
