package com.leaderboard.hosted.controller;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.model.Leaderboard;
import com.leaderboard.hosted.model.LeaderboardStatus;
import com.leaderboard.hosted.model.ScoreOrdering;
import com.leaderboard.hosted.model.UpdatePolicy;
import com.leaderboard.hosted.service.AdminAuthenticator;
import com.leaderboard.hosted.service.LeaderboardRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
@EnableConfigurationProperties(LeaderboardProperties.class)
@Import(AdminAuthenticator.class)
@TestPropertySource(properties = "leaderboard.admin.token=admin-token")
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LeaderboardRegistry leaderboardRegistry;

    private static Leaderboard leaderboard(LeaderboardStatus status) {
        return Leaderboard.builder()
            .id("lb-1")
            .secret("fresh-secret")
            .name("Weekly")
            .ordering(ScoreOrdering.HIGHER_IS_BETTER)
            .updatePolicy(UpdatePolicy.KEEP_BEST)
            .status(status)
            .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    }

    @Test
    void testCreateLeaderboard_ReturnsSecret() throws Exception {
        when(leaderboardRegistry.provision(eq("Weekly"), eq(ScoreOrdering.HIGHER_IS_BETTER),
            eq(UpdatePolicy.KEEP_BEST), any(), any())).thenReturn(leaderboard(LeaderboardStatus.ACTIVE));

        mockMvc.perform(post("/api/v1/admin/leaderboards")
                .header("Authorization", "Bearer admin-token")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Weekly\",\"ordering\":\"HIGHER_IS_BETTER\",\"updatePolicy\":\"KEEP_BEST\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("lb-1"))
            .andExpect(jsonPath("$.secret").value("fresh-secret"));
    }

    @Test
    void testCreateLeaderboard_RequiresToken() throws Exception {
        mockMvc.perform(post("/api/v1/admin/leaderboards")
                .header("Authorization", "Bearer wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ordering\":\"HIGHER_IS_BETTER\",\"updatePolicy\":\"KEEP_BEST\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.errorCode").value("AUTHENTICATION_FAILED"));

        mockMvc.perform(post("/api/v1/admin/leaderboards")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ordering\":\"HIGHER_IS_BETTER\",\"updatePolicy\":\"KEEP_BEST\"}"))
            .andExpect(status().isUnauthorized());

        verifyNoInteractions(leaderboardRegistry);
    }

    @Test
    void testDeleteLeaderboard_HidesSecret() throws Exception {
        when(leaderboardRegistry.softDelete("lb-1")).thenReturn(leaderboard(LeaderboardStatus.DELETED));

        mockMvc.perform(delete("/api/v1/admin/leaderboards/lb-1").header("Authorization", "Bearer admin-token"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DELETED"))
            .andExpect(jsonPath("$.secret").doesNotExist());
    }
}
