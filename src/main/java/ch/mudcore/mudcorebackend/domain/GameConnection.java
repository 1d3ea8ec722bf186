package ch.mudcore.mudcorebackend.domain;

import ch.mudcore.mudcorebackend.domain.enums.ClientStateType;

/**
 * A live client connection as seen by the identity backend.
 *
 * <p>Implemented by the transport layer (telnet, websocket, virtual test clients). The
 * backend never reads or writes raw I/O beyond {@link #write(String)} and {@link #end()};
 * handshake coordination goes through the typed {@link TransferContext} and
 * {@link #signal(TransferSignal)}.
 */
public interface GameConnection {

    /**
     * Transport specific id, e.g. {@code telnet:10.0.0.4:51234} or {@code ws:...}.
     */
    String getId();

    void write(String text);

    /**
     * Closes the underlying transport.
     */
    void end();

    ClientStateType getState();

    void setState(ClientStateType state);

    boolean isAuthenticated();

    void setAuthenticated(boolean authenticated);

    PlayerRecord getPlayer();

    void setPlayer(PlayerRecord player);

    TransferContext getTransferContext();

    /**
     * Delivers a handshake message to this connection's state machine.
     */
    void signal(TransferSignal signal);
}
