package com.leaderboard.hosted.service;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 signatures for score submissions, keyed by the player key.
 *
 * <p>The signed payload is the newline-joined sequence of the timestamp in
 * epoch milliseconds, the leaderboard secret, the player id, the score as
 * printed by {@link Double#toString(double)} and the metadata (empty when
 * absent). The leaderboard secret itself never travels with the request.
 */
@Component
public class SubmissionSignatures {

    private static final String ALGORITHM = "HmacSHA256";

    public String sign(String playerKey, long timestampMillis, String leaderboardSecret,
                       String playerId, double score, String metadata) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(playerKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(
                payload(timestampMillis, leaderboardSecret, playerId, score, metadata).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    public boolean verify(String playerKey, String signature, long timestampMillis, String leaderboardSecret,
                          String playerId, double score, String metadata) {
        if (playerKey == null || signature == null) {
            return false;
        }
        String expected = sign(playerKey, timestampMillis, leaderboardSecret, playerId, score, metadata);
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            signature.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }

    static String payload(long timestampMillis, String leaderboardSecret, String playerId,
                          double score, String metadata) {
        return timestampMillis + "\n" + leaderboardSecret + "\n" + playerId + "\n"
            + Double.toString(score) + "\n" + (metadata != null ? metadata : "");
    }
}
