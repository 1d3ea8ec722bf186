package ch.mudcore.mudcorebackend.service.session;

import ch.mudcore.mudcorebackend.domain.GameConnection;
import ch.mudcore.mudcorebackend.domain.PendingTransfer;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.domain.PlayerUpdate;
import ch.mudcore.mudcorebackend.domain.TransferContext;
import ch.mudcore.mudcorebackend.domain.TransferSignal;
import ch.mudcore.mudcorebackend.domain.enums.ClientStateType;
import ch.mudcore.mudcorebackend.domain.enums.TransferPhase;
import ch.mudcore.mudcorebackend.domain.enums.TransferSignalType;
import ch.mudcore.mudcorebackend.service.combat.CombatGateway;
import ch.mudcore.mudcorebackend.service.user.UserStore;
import ch.mudcore.mudcorebackend.service.user.UsernamePolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Drives the takeover handshake when a second login arrives for an identity that is
 * already bound to a live connection.
 *
 * <p>Flow:
 * <ol>
 *   <li>{@link #requestTransfer}: the newcomer waits, the current owner is interrupted and
 *       asked to decide</li>
 *   <li>{@link #resolveTransfer} with {@code true}: the newcomer receives a copy of the
 *       record and becomes the bound connection, combat state is handed over, the old
 *       connection is closed after a grace delay</li>
 *   <li>{@link #resolveTransfer} with {@code false} or {@link #cancelTransfer}: the newcomer
 *       goes back to login, the owner resumes where it was</li>
 * </ol>
 *
 * <p>An approval for an identity whose stored record has vanished in the meantime (reload,
 * snapshot restore) is treated as a denial: the owner keeps the session.
 *
 * <p>Denial and cancellation remove the pending entry as their last step, so the identity
 * reads as {@link TransferPhase#TRANSFER_PENDING} until both sides have been signalled.
 * Approval clears it when the newcomer is registered.
 */
@Service
@Slf4j
public class TransferCoordinator {

    private final UserStore userStore;
    private final SessionRegistry sessionRegistry;
    private final Optional<CombatGateway> combatGateway;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    /**
     * Delay before a superseded connection is closed, in milliseconds. Gives combat
     * processing on the old connection time to settle after the handoff.
     */
    @Getter
    @Value("${mudcore.session.transfer-grace-ms:7000}")
    private long transferGraceMs = 7000;

    public TransferCoordinator(UserStore userStore,
                               SessionRegistry sessionRegistry,
                               Optional<CombatGateway> combatGateway,
                               TaskScheduler taskScheduler,
                               Clock clock) {
        this.userStore = userStore;
        this.sessionRegistry = sessionRegistry;
        this.combatGateway = combatGateway;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    public TransferPhase phaseOf(String username) {
        if (sessionRegistry.getPendingTransfer(username).isPresent()) {
            return TransferPhase.TRANSFER_PENDING;
        }
        return sessionRegistry.isActive(username) ? TransferPhase.ACTIVE : TransferPhase.NONE;
    }

    /**
     * Asks the current owner of an identity to hand the session over to a new connection.
     *
     * @param username identity the newcomer authenticated as
     * @param incoming the new connection
     * @return {@code false} if the identity has no live session, or a transfer for it is
     *         already pending (the newcomer is told so and the earlier request stays)
     */
    public boolean requestTransfer(String username, GameConnection incoming) {
        String key = UsernamePolicy.normalize(username);
        Optional<GameConnection> owner = sessionRegistry.getActiveSession(key);
        if (owner.isEmpty()) {
            log.debug("Transfer request for {} ignored, no active session", key);
            return false;
        }

        Optional<PendingTransfer> alreadyPending = sessionRegistry.getPendingTransfer(key);
        if (alreadyPending.isPresent()) {
            log.warn("Rejected transfer request for {} from {}, request from {} still pending",
                    key, incoming.getId(), alreadyPending.get().incoming().getId());
            incoming.signal(TransferSignal.of(TransferSignalType.TRANSFER_REJECTED, key,
                    "Another session transfer for this account is already in progress."));
            return false;
        }

        GameConnection existing = owner.get();
        sessionRegistry.putPendingTransfer(new PendingTransfer(key, incoming, clock.instant()));

        // newcomer: remember where it came from, block until decided
        TransferContext incomingContext = incoming.getTransferContext();
        incomingContext.setPreviousState(incoming.getState());
        incomingContext.setWaitingForTransfer(true);
        incomingContext.setTransferUsername(username);
        incoming.signal(TransferSignal.of(TransferSignalType.AWAITING_DECISION, key,
                "This account is already logged in. Waiting for the active session to respond..."));

        // owner: force into the transfer prompt on its next I/O turn
        TransferContext existingContext = existing.getTransferContext();
        existingContext.setReturnToState(existing.getState());
        existingContext.setForcedTransition(ClientStateType.TRANSFER_REQUEST);
        existingContext.setTransferClient(incoming);
        existingContext.setInterruptedBy(incoming.getId());
        existing.signal(TransferSignal.of(TransferSignalType.TRANSFER_REQUESTED, key,
                "Someone is trying to log in to your account. Allow the session transfer?"));
        existing.write("");

        log.info("Session transfer requested for {} (owner {}, incoming {})",
                key, existing.getId(), incoming.getId());
        return true;
    }

    /**
     * Applies the owner's decision on a pending transfer. No-op if there is no pending
     * transfer or no live session for the identity.
     *
     * @param approved {@code true} to hand the session to the waiting connection
     */
    public void resolveTransfer(String username, boolean approved) {
        String key = UsernamePolicy.normalize(username);
        Optional<PendingTransfer> pending = sessionRegistry.getPendingTransfer(key);
        Optional<GameConnection> owner = sessionRegistry.getActiveSession(key);
        if (pending.isEmpty() || owner.isEmpty()) {
            log.debug("Nothing to resolve for {} (pending: {}, session: {})",
                    key, pending.isPresent(), owner.isPresent());
            return;
        }

        GameConnection incoming = pending.get().incoming();
        GameConnection existing = owner.get();

        if (!approved) {
            deny(key, existing, incoming,
                    "Session transfer was denied by the active user.",
                    "You denied the session transfer. Continuing your session.");
        } else {
            Optional<PlayerRecord> stored = userStore.getUser(key);
            if (stored.isPresent()) {
                approve(key, existing, incoming, stored.get());
            } else {
                log.error("Approved transfer for {} but no stored record exists, keeping {}",
                        key, existing.getId());
                deny(key, existing, incoming,
                        "Session transfer failed. Please log in again.",
                        "Session transfer failed. Continuing your session.");
            }
        }

        sessionRegistry.removePendingTransfer(key);
    }

    /**
     * Abandons a pending transfer, e.g. because one side disconnected. The newcomer goes
     * back to login. The owner loses its interrupt markers whether or not it has reached
     * the transfer prompt yet, and is put back into its earlier state if it has.
     */
    public void cancelTransfer(String username) {
        String key = UsernamePolicy.normalize(username);
        Optional<PendingTransfer> pending = sessionRegistry.getPendingTransfer(key);
        if (pending.isEmpty()) {
            log.debug("No pending transfer to cancel for {}", key);
            return;
        }

        GameConnection incoming = pending.get().incoming();
        incoming.getTransferContext().setWaitingForTransfer(false);
        incoming.getTransferContext().setTransitionTo(ClientStateType.LOGIN);
        incoming.signal(TransferSignal.of(TransferSignalType.TRANSFER_CANCELLED, key,
                "Session transfer was cancelled."));

        sessionRegistry.getActiveSession(key).ifPresent(existing -> {
            if (existing.getState() == ClientStateType.TRANSFER_REQUEST) {
                restoreOwner(existing);
            } else {
                existing.getTransferContext().clearInterrupt();
            }
            existing.signal(TransferSignal.of(TransferSignalType.TRANSFER_CANCELLED, key,
                    "Transfer request cancelled."));
        });

        log.info("Session transfer for {} cancelled", key);
        sessionRegistry.removePendingTransfer(key);
    }

    private void approve(String key, GameConnection existing, GameConnection incoming, PlayerRecord stored) {
        Instant handoverAt = clock.instant();
        existing.signal(TransferSignal.of(TransferSignalType.SESSION_RELEASED, key,
                "You approved the session transfer. Disconnecting..."));
        existing.getTransferContext().setTransferInProgress(true);
        existing.getTransferContext().setReleasedAt(handoverAt);
        incoming.getTransferContext().setSessionTransfer(true);
        incoming.getTransferContext().setBoundAt(handoverAt);

        // must be captured before the binding changes
        boolean inCombat = isInCombat(existing);
        log.info("Approving session transfer for {} (in combat: {})", key, inCombat);

        PlayerRecord copy = stored.copy();
        incoming.setPlayer(copy);
        incoming.setAuthenticated(true);
        incoming.getTransferContext().setWaitingForTransfer(false);

        sessionRegistry.registerSession(key, incoming);

        if (inCombat) {
            copy.setInCombat(true);
            userStore.updateUserStats(key, PlayerUpdate.builder().inCombat(true).build());
            handOverCombat(key, existing, incoming);
        }

        userStore.updateUserStats(key, PlayerUpdate.builder().lastLogin(handoverAt).build());

        incoming.signal(TransferSignal.of(TransferSignalType.TRANSFER_APPROVED, key,
                "Session transfer approved. Logging in..."));
        incoming.getTransferContext().setTransitionTo(ClientStateType.AUTHENTICATED);

        Instant teardownAt = handoverAt.plus(Duration.ofMillis(transferGraceMs));
        taskScheduler.schedule(() -> closeSuperseded(key, existing), teardownAt);
        log.debug("Scheduled close of superseded connection {} for {} in {}ms",
                existing.getId(), key, transferGraceMs);
    }

    private void deny(String key, GameConnection existing, GameConnection incoming,
                      String incomingMessage, String existingMessage) {
        incoming.getTransferContext().setWaitingForTransfer(false);
        incoming.getTransferContext().setTransitionTo(ClientStateType.LOGIN);
        incoming.signal(TransferSignal.of(TransferSignalType.TRANSFER_DENIED, key, incomingMessage));

        restoreOwner(existing);
        existing.signal(TransferSignal.of(TransferSignalType.SESSION_KEPT, key, existingMessage));

        log.info("Session transfer for {} denied, {} keeps the session", key, existing.getId());
    }

    private void restoreOwner(GameConnection existing) {
        TransferContext context = existing.getTransferContext();
        ClientStateType restored = context.getReturnToState() != null
                ? context.getReturnToState()
                : ClientStateType.AUTHENTICATED;
        existing.setState(restored);
        context.clearInterrupt();
    }

    private boolean isInCombat(GameConnection existing) {
        PlayerRecord attached = existing.getPlayer();
        if (attached != null && attached.isInCombat()) {
            return true;
        }
        if (combatGateway.isEmpty()) {
            return false;
        }
        try {
            return combatGateway.get().isInCombat(existing);
        } catch (RuntimeException e) {
            log.error("Combat state lookup failed for {}: {}", existing.getId(), e.getMessage(), e);
            return false;
        }
    }

    private void handOverCombat(String key, GameConnection existing, GameConnection incoming) {
        if (combatGateway.isEmpty()) {
            return;
        }
        try {
            combatGateway.get().handleSessionTransfer(existing, incoming);
        } catch (RuntimeException e) {
            log.error("Error transferring combat state for {}: {}", key, e.getMessage(), e);
        }
    }

    private void closeSuperseded(String key, GameConnection existing) {
        log.info("Disconnecting old connection {} for {} after transfer", existing.getId(), key);
        existing.setAuthenticated(false);
        existing.setPlayer(null);
        existing.end();
    }
}
