package ch.mudcore.mudcorebackend.web.api.dto;

import ch.mudcore.mudcorebackend.domain.GameConnection;
import ch.mudcore.mudcorebackend.domain.enums.ClientStateType;
import ch.mudcore.mudcorebackend.domain.enums.TransferPhase;

/**
 * DTO describing one live identity binding.
 *
 * @param username bound identity
 * @param connectionId transport id of the bound connection
 * @param state current state of the connection's state machine
 * @param authenticated whether the connection is marked authenticated
 * @param phase transfer phase of the identity
 */
public record SessionInfoDto(
        String username,
        String connectionId,
        ClientStateType state,
        boolean authenticated,
        TransferPhase phase
) {

    public static SessionInfoDto from(String username, GameConnection connection, TransferPhase phase) {
        return new SessionInfoDto(
                username,
                connection.getId(),
                connection.getState(),
                connection.isAuthenticated(),
                phase
        );
    }
}
