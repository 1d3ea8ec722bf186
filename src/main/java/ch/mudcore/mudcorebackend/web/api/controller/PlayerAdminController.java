package ch.mudcore.mudcorebackend.web.api.controller;

import ch.mudcore.mudcorebackend.domain.PlayerUpdate;
import ch.mudcore.mudcorebackend.service.session.SessionRegistry;
import ch.mudcore.mudcorebackend.service.user.UserStore;
import ch.mudcore.mudcorebackend.web.api.dto.FlagsDto;
import ch.mudcore.mudcorebackend.web.api.dto.PlayerDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Administrative access to player records.
 *
 * <p>Every change goes through {@link UserStore} and is therefore persisted like any
 * in-game mutation. Unknown usernames answer 404.
 */
@RestController
@RequestMapping("/api/players")
@RequiredArgsConstructor
@Slf4j
public class PlayerAdminController {

    private final UserStore userStore;
    private final SessionRegistry sessionRegistry;

    @Operation(summary = "List all registered players")
    @GetMapping
    public List<PlayerDto> listPlayers() {
        return userStore.getAllUsers().stream()
                .map(record -> PlayerDto.from(record, sessionRegistry.isActive(record.getUsername())))
                .toList();
    }

    @Operation(summary = "Get a single player by username (case-insensitive)")
    @GetMapping("/{username}")
    public ResponseEntity<PlayerDto> getPlayer(@PathVariable String username) {
        return userStore.getUser(username)
                .map(record -> PlayerDto.from(record, sessionRegistry.isActive(record.getUsername())))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Delete a player record")
    @DeleteMapping("/{username}")
    public ResponseEntity<Void> deletePlayer(@PathVariable String username) {
        if (sessionRegistry.isActive(username)) {
            // the live connection still holds a copy of the record
            return ResponseEntity.status(409).build();
        }
        if (!userStore.deleteUser(username)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Apply a partial stat update to a player")
    @PatchMapping("/{username}/stats")
    public ResponseEntity<PlayerDto> updateStats(@PathVariable String username,
                                                 @RequestBody PlayerUpdate update) {
        try {
            validate(update);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected stat update for {}: {}", username, e.getMessage());
            return ResponseEntity.badRequest().build();
        }
        if (!userStore.updateUserStats(username, update)) {
            return ResponseEntity.notFound().build();
        }
        return getPlayer(username);
    }

    @Operation(summary = "Add a flag to a player")
    @PutMapping("/{username}/flags/{flag}")
    public ResponseEntity<FlagsDto> addFlag(@PathVariable String username, @PathVariable String flag) {
        if (!userStore.userExists(username)) {
            return ResponseEntity.notFound().build();
        }
        boolean changed = userStore.addFlag(username, flag);
        return ResponseEntity.ok(flagsOf(username, changed));
    }

    @Operation(summary = "Remove a flag from a player")
    @DeleteMapping("/{username}/flags/{flag}")
    public ResponseEntity<FlagsDto> removeFlag(@PathVariable String username, @PathVariable String flag) {
        if (!userStore.userExists(username)) {
            return ResponseEntity.notFound().build();
        }
        boolean changed = userStore.removeFlag(username, flag);
        return ResponseEntity.ok(flagsOf(username, changed));
    }

    private FlagsDto flagsOf(String username, boolean changed) {
        String normalized = userStore.getUser(username).map(r -> r.getUsername()).orElse(username);
        return new FlagsDto(normalized, userStore.getFlags(username).orElse(List.of()), changed);
    }

    private static void validate(PlayerUpdate update) {
        requireNonNegative("maxHealth", update.getMaxHealth());
        requireNonNegative("maxMana", update.getMaxMana());
        requireNonNegative("mana", update.getMana());
        requireNonNegative("experience", update.getExperience());
        if (update.getLevel() != null && update.getLevel() < 1) {
            throw new IllegalArgumentException("level must be at least 1");
        }
        if (update.getCurrentRoomId() != null && update.getCurrentRoomId().isBlank()) {
            throw new IllegalArgumentException("currentRoomId must not be blank");
        }
    }

    private static void requireNonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
    }
}
