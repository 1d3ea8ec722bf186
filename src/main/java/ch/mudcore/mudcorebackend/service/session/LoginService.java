package ch.mudcore.mudcorebackend.service.session;

import ch.mudcore.mudcorebackend.domain.GameConnection;
import ch.mudcore.mudcorebackend.domain.PendingTransfer;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.domain.TransferContext;
import ch.mudcore.mudcorebackend.domain.enums.LoginOutcome;
import ch.mudcore.mudcorebackend.service.auth.PasswordAuthenticator;
import ch.mudcore.mudcorebackend.service.user.UserStore;
import ch.mudcore.mudcorebackend.service.user.UsernamePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point used by the transport's login and disconnect handling.
 *
 * <p>Binds an authenticated connection to its identity directly when the identity is free,
 * or hands over to {@link TransferCoordinator} when it is already bound elsewhere.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoginService {

    private final PasswordAuthenticator authenticator;
    private final UserStore userStore;
    private final SessionRegistry sessionRegistry;
    private final TransferCoordinator transferCoordinator;
    private final Clock clock;

    /**
     * Connection id -> identity and start instant, for play time accounting.
     */
    private final Map<String, SessionClock> clocks = new ConcurrentHashMap<>();

    public LoginOutcome login(String username, String password, GameConnection connection) {
        if (!authenticator.authenticate(username, password)) {
            log.info("Failed login attempt for '{}' from {}", username, connection.getId());
            return LoginOutcome.INVALID_CREDENTIALS;
        }
        String key = UsernamePolicy.normalize(username);

        if (sessionRegistry.isActive(key)) {
            if (transferCoordinator.requestTransfer(key, connection)) {
                clocks.put(connection.getId(), new SessionClock(key, clock.instant()));
                return LoginOutcome.TRANSFER_REQUESTED;
            }
            return LoginOutcome.TRANSFER_REJECTED;
        }

        Optional<PlayerRecord> stored = userStore.getUser(key);
        if (stored.isEmpty()) {
            // deleted between authentication and binding
            return LoginOutcome.INVALID_CREDENTIALS;
        }
        connection.setPlayer(stored.get().copy());
        connection.setAuthenticated(true);
        sessionRegistry.registerSession(key, connection);
        userStore.updateLastLogin(key);
        clocks.put(connection.getId(), new SessionClock(key, clock.instant()));
        return LoginOutcome.LOGGED_IN;
    }

    /**
     * Handles a closed connection.
     *
     * <p>If it was waiting on a transfer, that transfer is cancelled. If it is the bound
     * connection of its identity, the session is unregistered; a superseded connection
     * closing after a transfer leaves the live session alone.
     *
     * <p>Play time is added for the span the connection actually held the session: a
     * newcomer counts from the approved handover, not from its transfer request, and a
     * superseded owner stops counting at the handover, not when its grace delay ends.
     */
    public void disconnect(GameConnection connection) {
        for (PendingTransfer pending : sessionRegistry.getAllPendingTransfers().values()) {
            if (pending.incoming() == connection) {
                log.info("Waiting connection {} closed, cancelling transfer for {}",
                        connection.getId(), pending.username());
                transferCoordinator.cancelTransfer(pending.username());
            }
        }

        SessionClock sessionClock = clocks.remove(connection.getId());
        PlayerRecord player = connection.getPlayer();
        if (player != null) {
            Optional<GameConnection> bound = sessionRegistry.getActiveSession(player.getUsername());
            if (bound.isPresent() && bound.get() == connection) {
                transferCoordinator.cancelTransfer(player.getUsername());
                sessionRegistry.unregisterSession(player.getUsername());
            } else {
                log.debug("Connection {} closed but session for {} is bound elsewhere",
                        connection.getId(), player.getUsername());
            }
        }

        // a denied newcomer never played; a superseded owner has already been detached
        boolean played = player != null || connection.getTransferContext().isTransferInProgress();
        if (sessionClock != null && played) {
            long seconds = playedSeconds(sessionClock, connection.getTransferContext());
            userStore.updateTotalPlayTime(sessionClock.username(), seconds);
        }
    }

    private long playedSeconds(SessionClock sessionClock, TransferContext context) {
        Instant from = sessionClock.since();
        if (context.getBoundAt() != null && context.getBoundAt().isAfter(from)) {
            from = context.getBoundAt();
        }
        Instant until = context.getReleasedAt() != null ? context.getReleasedAt() : clock.instant();
        return Math.max(0, Duration.between(from, until).getSeconds());
    }

    private record SessionClock(String username, Instant since) {
    }
}
