package ch.mudcore.mudcorebackend.domain.enums;

/**
 * Kinds of handshake messages sent to connections during a session transfer.
 */
public enum TransferSignalType {
    /** To the owner: someone else wants this session, a decision is required. */
    TRANSFER_REQUESTED,
    /** To the newcomer: waiting for the owner's decision. */
    AWAITING_DECISION,
    /** To the newcomer: transfer approved, session is now yours. */
    TRANSFER_APPROVED,
    /** To the owner: you approved, this connection will be closed. */
    SESSION_RELEASED,
    /** To the newcomer: the owner denied the transfer. */
    TRANSFER_DENIED,
    /** To the owner: you denied, session continues. */
    SESSION_KEPT,
    /** To either side: the handshake was abandoned. */
    TRANSFER_CANCELLED,
    /** To a newcomer that arrived while another transfer was already pending. */
    TRANSFER_REJECTED
}
