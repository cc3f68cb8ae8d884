package com.leaderboard.hosted.service;

import com.leaderboard.hosted.config.LeaderboardProperties;
import com.leaderboard.hosted.exception.AuthenticationFailedException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the bearer token of admin requests against
 * {@code leaderboard.admin.token}. Without a configured token every admin
 * request is refused.
 */
@Component
public class AdminAuthenticator {

    private static final String BEARER = "Bearer ";

    private final LeaderboardProperties properties;

    public AdminAuthenticator(LeaderboardProperties properties) {
        this.properties = properties;
    }

    public void check(String authorizationHeader) {
        String token = properties.getAdmin().getToken();
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailedException("Admin API is disabled");
        }
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER)) {
            throw new AuthenticationFailedException("Missing admin bearer token");
        }
        byte[] supplied = authorizationHeader.substring(BEARER.length()).trim().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8), supplied)) {
            throw new AuthenticationFailedException("Invalid admin token");
        }
    }
}
