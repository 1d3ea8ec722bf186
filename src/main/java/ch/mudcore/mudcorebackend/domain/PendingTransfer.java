package ch.mudcore.mudcorebackend.domain;

import java.time.Instant;

/**
 * A login that wants to take over an identity whose session is still bound to another
 * connection. Lives only between {@code requestTransfer} and its resolution; never persisted.
 *
 * @param username normalized username of the contested identity
 * @param incoming connection waiting for the decision
 * @param requestedAt when the request was made
 */
public record PendingTransfer(String username, GameConnection incoming, Instant requestedAt) {
}
