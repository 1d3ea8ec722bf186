package ch.mudcore.mudcorebackend.domain;

import ch.mudcore.mudcorebackend.domain.enums.TransferSignalType;

import java.time.Instant;

/**
 * Tagged handshake message delivered to a connection's own state machine.
 *
 * <p>The transport decides how to render it; this backend only decides which signal
 * goes to which connection.
 *
 * @param type what happened
 * @param username identity the handshake is about
 * @param message human readable text for the player
 * @param timestamp when the signal was produced
 */
public record TransferSignal(
        TransferSignalType type,
        String username,
        String message,
        Instant timestamp
) {
    public static TransferSignal of(TransferSignalType type, String username, String message) {
        return new TransferSignal(type, username, message, Instant.now());
    }
}
