package ch.mudcore.mudcorebackend.domain;

import ch.mudcore.mudcorebackend.domain.enums.ClientStateType;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Per-connection handshake data shared between the transfer coordinator and the
 * connection's own state machine.
 *
 * <p>The coordinator only sets and clears these fields; interpreting them (entering the
 * transfer prompt, redirecting to login) belongs to the connection side.
 */
@Getter
@Setter
public class TransferContext {

    /**
     * State the incoming connection was in before it started waiting.
     */
    private ClientStateType previousState;

    /**
     * Incoming connection is blocked until the current owner decides.
     */
    private boolean waitingForTransfer;

    /**
     * Identity the incoming connection asked for.
     */
    private String transferUsername;

    /**
     * State the owning connection must be forced into on its next I/O turn.
     */
    private ClientStateType forcedTransition;

    /**
     * Incoming connection the owner is being asked about.
     */
    private GameConnection transferClient;

    /**
     * Set on the incoming connection once it has taken over a session.
     */
    private boolean sessionTransfer;

    /**
     * Set on the owning connection once it has approved and is about to be closed.
     */
    private boolean transferInProgress;

    /**
     * When this connection took over its session through an approved transfer.
     */
    private Instant boundAt;

    /**
     * When this connection handed its session to another one. It plays no further part
     * in the game after this instant, even while it waits to be closed.
     */
    private Instant releasedAt;

    /**
     * State to restore on the owning connection if the transfer is denied or cancelled.
     */
    private ClientStateType returnToState;

    /**
     * Id of the connection whose login interrupted this one.
     */
    private String interruptedBy;

    /**
     * State the connection should move to next, consumed by its state machine.
     */
    private ClientStateType transitionTo;

    /**
     * Removes the interrupt markers from an owning connection.
     */
    public void clearInterrupt() {
        forcedTransition = null;
        transferClient = null;
        interruptedBy = null;
    }
}
