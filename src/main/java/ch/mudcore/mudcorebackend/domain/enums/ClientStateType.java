package ch.mudcore.mudcorebackend.domain.enums;

/**
 * States of a connection's own state machine that the identity backend refers to.
 */
public enum ClientStateType {
    CONNECTING,
    LOGIN,
    SIGNUP,
    AUTHENTICATED,
    GAME,
    TRANSFER_REQUEST
}
