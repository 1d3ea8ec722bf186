package ch.mudcore.mudcorebackend.service.combat;

import ch.mudcore.mudcorebackend.domain.GameConnection;

/**
 * Combat subsystem as seen by the session layer.
 *
 * <p>No implementation ships with this backend; the game server registers one as a bean.
 * When none is present, nobody is ever considered in combat.
 */
public interface CombatGateway {

    boolean isInCombat(GameConnection connection);

    /**
     * Moves any running encounter from the old connection to the new one.
     */
    void handleSessionTransfer(GameConnection oldConnection, GameConnection newConnection);
}
