package ch.mudcore.mudcorebackend.testutil;

import ch.mudcore.mudcorebackend.domain.HashedPassword;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;

import java.time.Instant;

public final class PlayerFixtures {

    public static final Instant JOINED = Instant.parse("2024-01-15T10:00:00Z");

    private PlayerFixtures() {
        // utility class
    }

    /**
     * Freshly registered player with a dummy (non-verifiable) credential.
     */
    public static PlayerRecord player(String username) {
        return PlayerRecord.newPlayer(username, new HashedPassword("ab".repeat(64), "cd".repeat(16)), JOINED);
    }

    /**
     * Imported record still carrying a plaintext password and nothing else.
     */
    public static PlayerRecord legacyPlayer(String username, String plaintext) {
        PlayerRecord record = new PlayerRecord(username);
        record.setPassword(plaintext);
        return record;
    }
}
