package ch.mudcore.mudcorebackend.service.session;

import ch.mudcore.mudcorebackend.domain.GameConnection;
import ch.mudcore.mudcorebackend.domain.PendingTransfer;
import ch.mudcore.mudcorebackend.service.user.UsernamePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live identity to connection bindings, plus the pending-transfer slot per identity.
 *
 * <p>At most one connection is bound per (normalized) username. A pending transfer only
 * exists while the identity is bound; both {@link #registerSession} and
 * {@link #unregisterSession} clear it.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Map<String, GameConnection> activeSessions = new ConcurrentHashMap<>();
    private final Map<String, PendingTransfer> pendingTransfers = new ConcurrentHashMap<>();

    /**
     * Binds an identity to a connection, replacing any previous binding.
     */
    public void registerSession(String username, GameConnection connection) {
        String key = UsernamePolicy.normalize(username);
        GameConnection previous = activeSessions.put(key, connection);
        pendingTransfers.remove(key);

        if (previous != null && previous != connection) {
            log.info("Session for {} moved from {} to {}", key, previous.getId(), connection.getId());
        } else {
            log.info("User {} logged in ({})", key, connection.getId());
        }
    }

    /**
     * Removes the binding of an identity. Unknown identities are ignored.
     */
    public void unregisterSession(String username) {
        String key = UsernamePolicy.normalize(username);
        pendingTransfers.remove(key);
        if (activeSessions.remove(key) != null) {
            log.info("User {} logged out", key);
        }
    }

    public boolean isActive(String username) {
        return activeSessions.containsKey(UsernamePolicy.normalize(username));
    }

    public Optional<GameConnection> getActiveSession(String username) {
        return Optional.ofNullable(activeSessions.get(UsernamePolicy.normalize(username)));
    }

    /**
     * @return snapshot copy of all bindings, keyed by normalized username
     */
    public Map<String, GameConnection> getAllActiveSessions() {
        return new LinkedHashMap<>(activeSessions);
    }

    public Optional<PendingTransfer> getPendingTransfer(String username) {
        return Optional.ofNullable(pendingTransfers.get(UsernamePolicy.normalize(username)));
    }

    public void putPendingTransfer(PendingTransfer transfer) {
        pendingTransfers.put(UsernamePolicy.normalize(transfer.username()), transfer);
    }

    public void removePendingTransfer(String username) {
        pendingTransfers.remove(UsernamePolicy.normalize(username));
    }

    /**
     * @return snapshot copy of all pending transfers, keyed by normalized username
     */
    public Map<String, PendingTransfer> getAllPendingTransfers() {
        return new LinkedHashMap<>(pendingTransfers);
    }
}
