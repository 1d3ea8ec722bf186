package ch.mudcore.mudcorebackend.domain.enums;

/**
 * Session state of one identity as tracked by the transfer coordinator.
 *
 * <p>Transitions:
 * <ul>
 *   <li>NONE → ACTIVE (login)</li>
 *   <li>ACTIVE → TRANSFER_PENDING (second login)</li>
 *   <li>TRANSFER_PENDING → ACTIVE (approved: new connection; denied/cancelled: original)</li>
 *   <li>ACTIVE → NONE (disconnect)</li>
 * </ul>
 */
public enum TransferPhase {
    NONE,
    ACTIVE,
    TRANSFER_PENDING
}
