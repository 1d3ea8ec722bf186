package ch.mudcore.mudcorebackend.web.api.controller;

import ch.mudcore.mudcorebackend.config.StorageSettings;
import ch.mudcore.mudcorebackend.service.persistence.PersistenceGateway;
import ch.mudcore.mudcorebackend.service.persistence.PlayerStorageException;
import ch.mudcore.mudcorebackend.service.user.UserStore;
import ch.mudcore.mudcorebackend.web.api.dto.SnapshotRequest;
import ch.mudcore.mudcorebackend.web.api.dto.StorageActionResultDto;
import ch.mudcore.mudcorebackend.web.api.dto.StorageStatusDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Development-only storage operations: inspect the backend, force a save, toggle test
 * mode, export and import JSON snapshots.
 *
 * <p><b>WARNING:</b> {@code restore} replaces every player record in memory (and, unless
 * test mode is on, in the backends). Never expose this in production.
 */
@RestController
@RequestMapping("/api/dev/storage")
@RequiredArgsConstructor
@Profile({"dev", "test"})
@Slf4j
public class StorageDevController {

    private final UserStore userStore;
    private final PersistenceGateway persistenceGateway;
    private final StorageSettings settings;

    /**
     * <p>Example response:
     * <pre>
     * {
     *   "backend": "AUTO",
     *   "testMode": false,
     *   "usersFile": "./data/users.json",
     *   "userCount": 12
     * }
     * </pre>
     */
    @GetMapping
    @Operation(summary = "Gets the active storage backend and store size")
    public ResponseEntity<StorageStatusDto> getStatus() {
        return ResponseEntity.ok(new StorageStatusDto(
                persistenceGateway.getMode(),
                persistenceGateway.isTestMode(),
                settings.getUsersFile().toString(),
                userStore.size()
        ));
    }

    /**
     * Persists the current collection and waits for the relational write-behind to drain.
     */
    @PostMapping("/save")
    @Operation(summary = "Forces a save of all players")
    public ResponseEntity<StorageActionResultDto> forceSave() {
        userStore.forceSave().join();
        return ResponseEntity.ok(new StorageActionResultDto("Save completed", userStore.size()));
    }

    @PostMapping("/test-mode")
    @Operation(summary = "Enables or disables test mode (suppresses all writes)")
    public ResponseEntity<StorageStatusDto> setTestMode(@RequestParam boolean enabled) {
        persistenceGateway.setTestMode(enabled);
        return getStatus();
    }

    @PostMapping("/snapshot")
    @Operation(summary = "Writes all players to a JSON snapshot file")
    public ResponseEntity<StorageActionResultDto> snapshot(@RequestBody SnapshotRequest request) {
        if (request.path() == null || request.path().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            int count = userStore.saveToPath(resolve(request.path()));
            return ResponseEntity.ok(new StorageActionResultDto("Snapshot written", count));
        } catch (PlayerStorageException e) {
            log.error("Snapshot to {} failed: {}", request.path(), e.getMessage());
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/restore")
    @Operation(summary = "Replaces all players with the contents of a JSON snapshot file")
    public ResponseEntity<StorageActionResultDto> restore(@RequestBody SnapshotRequest request) {
        if (request.path() == null || request.path().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        Path file = resolve(request.path());
        if (!Files.exists(file)) {
            return ResponseEntity.notFound().build();
        }
        try {
            userStore.loadFromPath(file);
            return ResponseEntity.ok(new StorageActionResultDto("Snapshot restored", userStore.size()));
        } catch (PlayerStorageException | IllegalArgumentException e) {
            log.warn("Restore from {} rejected: {}", file, e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    private Path resolve(String path) {
        Path candidate = Path.of(path);
        return candidate.isAbsolute() ? candidate : settings.getDataDir().resolve(candidate);
    }
}
