package ch.mudcore.mudcorebackend.domain.enums;

/**
 * Result of a login attempt.
 */
public enum LoginOutcome {
    /** Unknown user or wrong password. */
    INVALID_CREDENTIALS,
    /** Session bound directly to the connection. */
    LOGGED_IN,
    /** Identity already bound elsewhere; the current owner was asked to hand over. */
    TRANSFER_REQUESTED,
    /** A transfer for this identity is already pending; attempt refused. */
    TRANSFER_REJECTED
}
