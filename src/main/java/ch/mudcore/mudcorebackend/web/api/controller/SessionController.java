package ch.mudcore.mudcorebackend.web.api.controller;

import ch.mudcore.mudcorebackend.domain.GameConnection;
import ch.mudcore.mudcorebackend.service.session.SessionRegistry;
import ch.mudcore.mudcorebackend.service.session.TransferCoordinator;
import ch.mudcore.mudcorebackend.web.api.dto.PendingTransferDto;
import ch.mudcore.mudcorebackend.web.api.dto.SessionInfoDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of live sessions and pending transfers.
 *
 * <p>Both lists are built from snapshot copies of the registry, so they are safe to call
 * while the game loop keeps mutating it.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionRegistry sessionRegistry;
    private final TransferCoordinator transferCoordinator;

    @Operation(summary = "List all identities with a bound connection")
    @GetMapping
    public List<SessionInfoDto> listSessions() {
        return sessionRegistry.getAllActiveSessions().entrySet().stream()
                .map(e -> SessionInfoDto.from(e.getKey(), e.getValue(), transferCoordinator.phaseOf(e.getKey())))
                .toList();
    }

    @Operation(summary = "List session transfers awaiting the owner's decision")
    @GetMapping("/transfers")
    public List<PendingTransferDto> listPendingTransfers() {
        return sessionRegistry.getAllPendingTransfers().values().stream()
                .map(transfer -> PendingTransferDto.from(
                        transfer,
                        sessionRegistry.getActiveSession(transfer.username())
                                .map(GameConnection::getId)
                                .orElse(null)))
                .toList();
    }
}
