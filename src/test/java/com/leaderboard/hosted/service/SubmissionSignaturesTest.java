package com.leaderboard.hosted.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionSignaturesTest {

    private final SubmissionSignatures signatures = new SubmissionSignatures();

    @Test
    void testSignatureIsLowercaseHexSha256() {
        String signature = signatures.sign("player-key", 1_700_000_000_000L, "secret", "alice", 12.5, null);

        assertEquals(64, signature.length());
        assertTrue(signature.matches("[0-9a-f]+"));
    }

    @Test
    void testVerifyAcceptsMatchingSignatureInAnyCase() {
        String signature = signatures.sign("player-key", 1_700_000_000_000L, "secret", "alice", 12.5, "lvl");

        assertTrue(signatures.verify("player-key", signature, 1_700_000_000_000L, "secret", "alice", 12.5, "lvl"));
        assertTrue(signatures.verify("player-key", signature.toUpperCase(), 1_700_000_000_000L, "secret", "alice", 12.5, "lvl"));
    }

    @Test
    void testVerifyRejectsAnyChangedField() {
        String signature = signatures.sign("player-key", 1000L, "secret", "alice", 12.5, "lvl");

        assertFalse(signatures.verify("other-key", signature, 1000L, "secret", "alice", 12.5, "lvl"));
        assertFalse(signatures.verify("player-key", signature, 1001L, "secret", "alice", 12.5, "lvl"));
        assertFalse(signatures.verify("player-key", signature, 1000L, "rotated", "alice", 12.5, "lvl"));
        assertFalse(signatures.verify("player-key", signature, 1000L, "secret", "bob", 12.5, "lvl"));
        assertFalse(signatures.verify("player-key", signature, 1000L, "secret", "alice", 12.6, "lvl"));
        assertFalse(signatures.verify("player-key", signature, 1000L, "secret", "alice", 12.5, null));
        assertFalse(signatures.verify("player-key", null, 1000L, "secret", "alice", 12.5, "lvl"));
    }

    @Test
    void testPayloadLayout() {
        assertEquals("1000\nsecret\nalice\n12.5\n", SubmissionSignatures.payload(1000L, "secret", "alice", 12.5, null));
        assertEquals("1000\nsecret\nalice\n3.0\nmeta", SubmissionSignatures.payload(1000L, "secret", "alice", 3, "meta"));
    }
}
