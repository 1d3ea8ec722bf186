package ch.mudcore.mudcorebackend.web.api.dto;

import ch.mudcore.mudcorebackend.domain.PendingTransfer;

import java.time.Instant;

/**
 * DTO describing a session transfer awaiting the owner's decision.
 *
 * @param username identity being transferred
 * @param incomingConnectionId connection waiting to take over
 * @param ownerConnectionId connection currently holding the session, null if already gone
 * @param requestedAt when the transfer was requested
 */
public record PendingTransferDto(
        String username,
        String incomingConnectionId,
        String ownerConnectionId,
        Instant requestedAt
) {

    public static PendingTransferDto from(PendingTransfer transfer, String ownerConnectionId) {
        return new PendingTransferDto(
                transfer.username(),
                transfer.incoming().getId(),
                ownerConnectionId,
                transfer.requestedAt()
        );
    }
}
