package com.leaderboard.hosted.service;

import com.leaderboard.hosted.exception.InvalidRequestException;
import com.leaderboard.hosted.exception.LeaderboardNotFoundException;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.LeaderboardStatus;
import com.leaderboard.hosted.model.ScoreOrdering;
import com.leaderboard.hosted.model.UpdatePolicy;
import com.leaderboard.hosted.repository.LeaderboardRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardRegistryTest {

    @Mock
    private LeaderboardRepository leaderboardRepository;

    @InjectMocks
    private LeaderboardRegistry leaderboardRegistry;

    private Leaderboard testLeaderboard;

    @BeforeEach
    void setUp() {
        testLeaderboard = Leaderboard.builder()
            .id("lb-1")
            .secret("s3cret")
            .name("Weekly")
            .ordering(ScoreOrdering.HIGHER_IS_BETTER)
            .updatePolicy(UpdatePolicy.KEEP_BEST)
            .status(LeaderboardStatus.ACTIVE)
            .createdAt(Instant.now())
            .build();
    }

    @Test
    void testResolve_CachesRepositoryLookup() {
        // Arrange
        when(leaderboardRepository.findById("lb-1")).thenReturn(Optional.of(testLeaderboard));

        // Act
        leaderboardRegistry.resolve("lb-1");
        Leaderboard resolved = leaderboardRegistry.resolve("lb-1");

        // Assert
        assertEquals("Weekly", resolved.getName());
        verify(leaderboardRepository, times(1)).findById("lb-1");
    }

    @Test
    void testResolve_UnknownId() {
        when(leaderboardRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(LeaderboardNotFoundException.class, () -> leaderboardRegistry.resolve("missing"));
    }

    @Test
    void testResolve_DeletedLeaderboardIsNotFound() {
        testLeaderboard.setStatus(LeaderboardStatus.DELETED);
        when(leaderboardRepository.findById("lb-1")).thenReturn(Optional.of(testLeaderboard));

        assertThrows(LeaderboardNotFoundException.class, () -> leaderboardRegistry.resolve("lb-1"));
        assertTrue(leaderboardRegistry.find("lb-1").isPresent());
    }

    @Test
    void testAuthenticate() {
        when(leaderboardRepository.findById("lb-1")).thenReturn(Optional.of(testLeaderboard));

        assertTrue(leaderboardRegistry.authenticate("lb-1", "s3cret"));
        assertFalse(leaderboardRegistry.authenticate("lb-1", "s3cret "));
        assertFalse(leaderboardRegistry.authenticate("lb-1", ""));
        assertFalse(leaderboardRegistry.authenticate("lb-1", null));
    }

    @Test
    void testProvision_IssuesIdAndSecret() {
        // Arrange
        when(leaderboardRepository.save(any(Leaderboard.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        Leaderboard created = leaderboardRegistry.provision("Speedrun", ScoreOrdering.LOWER_IS_BETTER,
            UpdatePolicy.KEEP_ALL, "admin", Map.of("season", 3));
        Leaderboard other = leaderboardRegistry.provision("Speedrun", ScoreOrdering.LOWER_IS_BETTER,
            UpdatePolicy.KEEP_ALL, "admin", null);

        // Assert
        assertNotNull(created.getId());
        assertNotEquals(created.getId(), other.getId());
        assertNotEquals(created.getSecret(), other.getSecret());
        assertEquals(43, created.getSecret().length());
        assertEquals(LeaderboardStatus.ACTIVE, created.getStatus());
        assertSame(created, leaderboardRegistry.resolve(created.getId()));
        verify(leaderboardRepository, never()).findById(created.getId());
    }

    @Test
    void testProvision_RequiresOrderingAndPolicy() {
        assertThrows(InvalidRequestException.class,
            () -> leaderboardRegistry.provision("x", null, UpdatePolicy.KEEP_BEST, null, null));
        assertThrows(InvalidRequestException.class,
            () -> leaderboardRegistry.provision("x", ScoreOrdering.HIGHER_IS_BETTER, null, null, null));
        verifyNoInteractions(leaderboardRepository);
    }

    @Test
    void testRotateSecret_InvalidatesOldSecret() {
        // Arrange
        when(leaderboardRepository.findById("lb-1")).thenReturn(Optional.of(testLeaderboard));
        when(leaderboardRepository.save(any(Leaderboard.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        Leaderboard rotated = leaderboardRegistry.rotateSecret("lb-1");

        // Assert
        assertNotEquals("s3cret", rotated.getSecret());
        assertFalse(leaderboardRegistry.authenticate("lb-1", "s3cret"));
        assertTrue(leaderboardRegistry.authenticate("lb-1", rotated.getSecret()));
        assertNotNull(rotated.getUpdatedAt());
    }

    @Test
    void testUpdateMetadata_KeepsOrderingAndPolicy() {
        when(leaderboardRepository.findById("lb-1")).thenReturn(Optional.of(testLeaderboard));
        ArgumentCaptor<Leaderboard> saved = ArgumentCaptor.forClass(Leaderboard.class);
        when(leaderboardRepository.save(saved.capture())).thenAnswer(invocation -> invocation.getArgument(0));

        leaderboardRegistry.updateMetadata("lb-1", "Monthly", Map.of("region", "eu"));

        assertEquals("Monthly", saved.getValue().getName());
        assertEquals(Map.of("region", "eu"), saved.getValue().getMetadata());
        assertEquals(ScoreOrdering.HIGHER_IS_BETTER, saved.getValue().getOrdering());
        assertEquals("s3cret", saved.getValue().getSecret());
    }

    @Test
    void testSoftDelete() {
        when(leaderboardRepository.findById("lb-1")).thenReturn(Optional.of(testLeaderboard));
        when(leaderboardRepository.save(any(Leaderboard.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Leaderboard deleted = leaderboardRegistry.softDelete("lb-1");

        assertEquals(LeaderboardStatus.DELETED, deleted.getStatus());
        assertThrows(LeaderboardNotFoundException.class, () -> leaderboardRegistry.resolve("lb-1"));
        assertThrows(LeaderboardNotFoundException.class, () -> leaderboardRegistry.softDelete("lb-1"));
    }

    @Test
    void testActiveLeaderboards() {
        Leaderboard deleted = testLeaderboard.toBuilder().id("lb-2").status(LeaderboardStatus.DELETED).build();
        when(leaderboardRepository.findAll()).thenReturn(List.of(testLeaderboard, deleted));

        assertEquals(List.of(testLeaderboard), leaderboardRegistry.activeLeaderboards());
    }
}
