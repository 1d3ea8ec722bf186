package ch.mudcore.mudcorebackend.service.user;

import ch.mudcore.mudcorebackend.config.StorageSettings;
import ch.mudcore.mudcorebackend.domain.Currency;
import ch.mudcore.mudcorebackend.domain.HashedPassword;
import ch.mudcore.mudcorebackend.domain.Inventory;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.domain.PlayerUpdate;
import ch.mudcore.mudcorebackend.service.auth.PasswordHasher;
import ch.mudcore.mudcorebackend.service.persistence.JsonFilePlayerStore;
import ch.mudcore.mudcorebackend.service.persistence.PersistenceGateway;
import ch.mudcore.mudcorebackend.service.persistence.PlayerStorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory canonical collection of player records, keyed by normalized username.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Case-insensitive lookup, existence checks and defensive listing</li>
 *   <li>Registration with username validation and default stats</li>
 *   <li>Partial updates (every mutation is followed by a persistence write)</li>
 *   <li>Bulk load of external records with normalization, backfill and legacy password
 *       migration</li>
 * </ul>
 *
 * <p>The collection map is copy-on-write: structural changes (create, delete, bulk load)
 * build a new map and publish it with a single volatile assignment, so a reader on another
 * thread never sees a half-populated store. Field updates mutate the record in place.
 */
@Service
@Slf4j
public class UserStore {

    private static final TypeReference<List<PlayerRecord>> RECORD_LIST_TYPE = new TypeReference<>() { };

    private final PersistenceGateway persistenceGateway;
    private final PasswordHasher passwordHasher;
    private final JsonFilePlayerStore snapshotStore;
    private final ObjectMapper objectMapper;
    private final StorageSettings settings;

    private volatile Map<String, PlayerRecord> records = new LinkedHashMap<>();

    public UserStore(PersistenceGateway persistenceGateway,
                     PasswordHasher passwordHasher,
                     JsonFilePlayerStore snapshotStore,
                     ObjectMapper objectMapper,
                     StorageSettings settings) {
        this.persistenceGateway = persistenceGateway;
        this.passwordHasher = passwordHasher;
        this.snapshotStore = snapshotStore;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    /**
     * Loads the player collection once the application is ready.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        reload();
    }

    /**
     * Replaces the collection with the configured source: the raw seed array when one is
     * configured (short-circuits normal loading), otherwise whatever the
     * {@link PersistenceGateway} loads for the active backend mode.
     */
    public void reload() {
        if (settings.hasSeedUsers()) {
            try {
                List<PlayerRecord> seeded = objectMapper.readValue(settings.getSeedUsers(), RECORD_LIST_TYPE);
                loadPrevalidatedUsers(seeded);
                return;
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("Failed to load seed users, falling back to storage: {}", e.getMessage());
            }
        }

        List<PlayerRecord> loaded = persistenceGateway.load();
        if (loaded.isEmpty()) {
            records = new LinkedHashMap<>();
            log.info("Player store is empty");
            return;
        }
        try {
            loadPrevalidatedUsers(loaded);
        } catch (IllegalArgumentException e) {
            log.error("Stored player data rejected, starting with an empty store: {}", e.getMessage());
            records = new LinkedHashMap<>();
        }
    }

    public Optional<PlayerRecord> getUser(String username) {
        return Optional.ofNullable(records.get(UsernamePolicy.normalize(username)));
    }

    public boolean userExists(String username) {
        return records.containsKey(UsernamePolicy.normalize(username));
    }

    /**
     * @return a new list holding the current records; later structural changes to the store
     *         do not affect it
     */
    public List<PlayerRecord> getAllUsers() {
        return new ArrayList<>(records.values());
    }

    public int size() {
        return records.size();
    }

    /**
     * Registers a new player.
     *
     * @return {@code false} if the username is malformed or already taken
     */
    public boolean createUser(String username, String password) {
        String normalized = UsernamePolicy.normalize(username);
        if (!UsernamePolicy.isValid(normalized)) {
            log.warn("Rejected registration with invalid username '{}'", username);
            return false;
        }
        if (userExists(normalized)) {
            log.warn("Rejected registration of existing username '{}'", normalized);
            return false;
        }

        HashedPassword credential = passwordHasher.hash(password);
        PlayerRecord created = PlayerRecord.newPlayer(normalized, credential, Instant.now());

        Map<String, PlayerRecord> next = new LinkedHashMap<>(records);
        next.put(normalized, created);
        records = next;

        log.info("Registered new user {}", normalized);
        persist();
        return true;
    }

    /**
     * Merges a patch into an existing record and persists.
     *
     * @return {@code false} if no such user exists; nothing is created in that case
     */
    public boolean updateUserStats(String username, PlayerUpdate update) {
        Optional<PlayerRecord> existing = getUser(username);
        if (existing.isEmpty()) {
            return false;
        }
        update.applyTo(existing.get());
        persist();
        return true;
    }

    /**
     * Replaces a record with the given data, keeping the stored username.
     *
     * @return {@code false} if no such user exists
     */
    public boolean updateUser(String username, PlayerRecord replacement) {
        String normalized = UsernamePolicy.normalize(username);
        if (!records.containsKey(normalized)) {
            return false;
        }
        PlayerRecord updated = replacement.copy();
        updated.normalizeUsername(normalized);
        updated.clampMana();

        Map<String, PlayerRecord> next = new LinkedHashMap<>(records);
        next.put(normalized, updated);
        records = next;

        persist();
        return true;
    }

    public boolean updateUserInventory(String username, Inventory inventory) {
        Optional<PlayerRecord> existing = getUser(username);
        if (existing.isEmpty()) {
            return false;
        }
        existing.get().setInventory(inventory);
        persist();
        return true;
    }

    public boolean updateLastLogin(String username) {
        Optional<PlayerRecord> existing = getUser(username);
        if (existing.isEmpty()) {
            return false;
        }
        existing.get().setLastLogin(Instant.now());
        persist();
        return true;
    }

    /**
     * Adds to the accumulated play time. Negative amounts are ignored.
     *
     * @param seconds play time to add
     * @return {@code false} if no such user exists
     */
    public boolean updateTotalPlayTime(String username, long seconds) {
        Optional<PlayerRecord> existing = getUser(username);
        if (existing.isEmpty()) {
            return false;
        }
        PlayerRecord record = existing.get();
        long current = record.getTotalPlayTime() == null ? 0L : record.getTotalPlayTime();
        record.setTotalPlayTime(current + Math.max(0L, seconds));
        persist();
        return true;
    }

    /**
     * Replaces the credential of a record, drops any legacy plaintext and persists.
     *
     * @return completes with {@code false} if no such user exists, otherwise with {@code true}
     *         once the write has been handed to every backend
     */
    public CompletableFuture<Boolean> replaceCredential(String username, HashedPassword credential) {
        Optional<PlayerRecord> existing = getUser(username);
        if (existing.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        PlayerRecord record = existing.get();
        record.setPasswordHash(credential.hash());
        record.setSalt(credential.salt());
        record.setPassword(null);
        return persist().thenApply(done -> true);
    }

    /**
     * Adds a flag unless already present.
     *
     * @return {@code true} only if the flag was newly added
     */
    public boolean addFlag(String username, String flag) {
        Optional<PlayerRecord> existing = getUser(username);
        if (existing.isEmpty()) {
            log.error("Cannot add flag: user {} not found", username);
            return false;
        }
        PlayerRecord record = existing.get();
        List<String> flags = record.getFlags() == null ? new ArrayList<>() : new ArrayList<>(record.getFlags());
        if (flags.contains(flag)) {
            log.info("Flag '{}' already set for user {}", flag, record.getUsername());
            return false;
        }
        flags.add(flag);
        record.setFlags(flags);
        persist();
        log.info("Added flag '{}' to user {}", flag, record.getUsername());
        return true;
    }

    /**
     * @return {@code true} only if the flag was present and removed
     */
    public boolean removeFlag(String username, String flag) {
        Optional<PlayerRecord> existing = getUser(username);
        if (existing.isEmpty() || existing.get().getFlags() == null) {
            log.error("Cannot remove flag: user {} not found or has no flags", username);
            return false;
        }
        PlayerRecord record = existing.get();
        List<String> flags = new ArrayList<>(record.getFlags());
        if (!flags.removeIf(f -> f.equals(flag))) {
            log.info("Flag '{}' not found for user {}", flag, record.getUsername());
            return false;
        }
        record.setFlags(flags);
        persist();
        log.info("Removed flag '{}' from user {}", flag, record.getUsername());
        return true;
    }

    public boolean hasFlag(String username, String flag) {
        return getUser(username)
                .map(PlayerRecord::getFlags)
                .map(flags -> flags.contains(flag))
                .orElse(false);
    }

    /**
     * @return a copy of the user's flags (empty if none), or empty optional for unknown users
     */
    public Optional<List<String>> getFlags(String username) {
        return getUser(username)
                .map(record -> record.getFlags() == null ? List.<String>of() : List.copyOf(record.getFlags()));
    }

    public boolean deleteUser(String username) {
        String normalized = UsernamePolicy.normalize(username);
        if (!records.containsKey(normalized)) {
            return false;
        }
        Map<String, PlayerRecord> next = new LinkedHashMap<>(records);
        next.remove(normalized);
        records = next;

        log.info("Deleted user {}", normalized);
        persist();
        return true;
    }

    /**
     * Replaces the whole collection with externally supplied records.
     *
     * <p>All records are validated first (username shape, uniqueness after normalization);
     * any violation throws and leaves the store untouched. Valid records are normalized:
     * lower-case username, missing dates set to now, missing inventory/items/currency and
     * play time backfilled, mana clamped, legacy plaintext passwords hashed. The new
     * collection is then published in one step and persisted if anything was changed.
     *
     * @param incoming records, possibly partial; ownership passes to the store
     * @throws IllegalArgumentException on a malformed or duplicate username
     */
    public void loadPrevalidatedUsers(List<PlayerRecord> incoming) {
        log.info("Loading {} pre-validated users...", incoming.size());

        Set<String> seen = new HashSet<>();
        for (PlayerRecord record : incoming) {
            String normalized = UsernamePolicy.normalize(record.getUsername());
            if (!UsernamePolicy.isValid(normalized)) {
                throw new IllegalArgumentException("Invalid username in user data: '" + record.getUsername() + "'");
            }
            if (!seen.add(normalized)) {
                throw new IllegalArgumentException("Duplicate username in user data: '" + normalized + "'");
            }
        }

        Instant now = Instant.now();
        boolean changed = false;
        Map<String, PlayerRecord> next = new LinkedHashMap<>();
        for (PlayerRecord record : incoming) {
            changed |= normalize(record, now);
            next.put(record.getUsername(), record);
        }
        records = next;

        if (changed) {
            persist();
        }
        log.info("Pre-validated users loaded successfully ({} users)", next.size());
    }

    /**
     * Replaces the collection with the records stored in a snapshot file.
     *
     * @throws PlayerStorageException if the file does not exist or cannot be parsed
     * @throws IllegalArgumentException if the file contains invalid usernames
     */
    public void loadFromPath(Path file) {
        if (!Files.exists(file)) {
            throw new PlayerStorageException("User data file not found: " + file);
        }
        List<PlayerRecord> loaded = snapshotStore.readFrom(file);
        loadPrevalidatedUsers(loaded);
        log.info("Loaded {} users from {}", loaded.size(), file);
    }

    /**
     * Writes the current collection to a snapshot file. Ignores test mode.
     *
     * @return number of users written
     * @throws PlayerStorageException if the file cannot be written
     */
    public int saveToPath(Path file) {
        List<PlayerRecord> snapshot = getAllUsers();
        snapshotStore.writeTo(file, snapshot);
        log.info("Saved {} users to {}", snapshot.size(), file);
        return snapshot.size();
    }

    /**
     * Persists the current collection.
     *
     * @return completion of the relational write-behind; join it to wait for durability
     */
    public CompletableFuture<Void> forceSave() {
        return persist();
    }

    /**
     * Periodic safety save, configured by {@code mudcore.storage.autosave-interval-ms}.
     */
    @Scheduled(fixedRateString = "${mudcore.storage.autosave-interval-ms:300000}",
            initialDelayString = "${mudcore.storage.autosave-interval-ms:300000}")
    public void autosave() {
        if (records.isEmpty()) {
            log.debug("Autosave skipped, no users loaded");
            return;
        }
        persist();
    }

    private CompletableFuture<Void> persist() {
        return persistenceGateway.save(getAllUsers());
    }

    private boolean normalize(PlayerRecord record, Instant now) {
        boolean changed = false;

        String normalized = UsernamePolicy.normalize(record.getUsername());
        if (!normalized.equals(record.getUsername())) {
            record.normalizeUsername(normalized);
            changed = true;
        }
        if (record.getJoinDate() == null) {
            record.setJoinDate(now);
            changed = true;
        }
        if (record.getLastLogin() == null) {
            record.setLastLogin(now);
            changed = true;
        }
        if (record.getInventory() == null) {
            record.setInventory(Inventory.empty());
            changed = true;
        } else {
            if (record.getInventory().getItems() == null) {
                record.getInventory().setItems(new ArrayList<>());
                changed = true;
            }
            if (record.getInventory().getCurrency() == null) {
                record.getInventory().setCurrency(Currency.empty());
                changed = true;
            }
        }
        if (record.getEquipment() == null) {
            record.setEquipment(new LinkedHashMap<>());
        }
        if (record.getCurrentRoomId() == null) {
            record.setCurrentRoomId("start");
            changed = true;
        }
        if (record.getTotalPlayTime() == null) {
            record.setTotalPlayTime(0L);
            changed = true;
        }
        changed |= record.clampMana();

        if (record.hasLegacyPassword()) {
            HashedPassword credential = passwordHasher.hash(record.getPassword());
            record.setPasswordHash(credential.hash());
            record.setSalt(credential.salt());
            record.setPassword(null);
            log.info("Migrated legacy password of user {}", normalized);
            changed = true;
        }
        return changed;
    }
}
