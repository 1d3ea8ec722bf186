package ch.mudcore.mudcorebackend.service.persistence;

import ch.mudcore.mudcorebackend.config.StorageSettings;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.domain.enums.StorageBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Loads and saves the player collection against the flat file and relational backends
 * according to the startup-selected {@link StorageBackend}.
 *
 * <p>Mode matrix:
 * <ul>
 *   <li><b>FILE</b>: load and save the JSON file only</li>
 *   <li><b>DATABASE</b>: load and save the database only; a failed load is logged and leaves
 *       the store empty, there is no fallback</li>
 *   <li><b>AUTO</b>: load from the database, falling back to the file on failure (or when the
 *       database is still empty but the file is not); save to the database through the
 *       write-behind queue <em>and</em> synchronously to the file as a durable backup</li>
 * </ul>
 *
 * <p>Save failures are logged and never retried or rethrown: the in-memory mutation that
 * triggered the save is considered successful regardless. Callers that need the relational
 * write to be durable can wait on the future returned by {@link #save(List)}.
 *
 * <p>In test mode every write is skipped; reads are unaffected.
 */
@Service
@Slf4j
public class PersistenceGateway {

    private final FlatFileBackend fileBackend;
    private final RelationalBackend relationalBackend;
    private final StorageBackend mode;

    private volatile boolean testMode;

    public PersistenceGateway(FlatFileBackend fileBackend,
                              RelationalBackend relationalBackend,
                              StorageSettings settings) {
        this.fileBackend = fileBackend;
        this.relationalBackend = relationalBackend;
        this.mode = settings.getBackend();
        this.testMode = settings.isTestMode();
        log.info("Player storage backend: {}{}", mode, testMode ? " (test mode, writes disabled)" : "");
    }

    public StorageBackend getMode() {
        return mode;
    }

    public boolean isTestMode() {
        return testMode;
    }

    /**
     * Enables or disables test mode. While enabled no backend is written.
     */
    public void setTestMode(boolean enabled) {
        this.testMode = enabled;
        log.info("Test mode {} - persistence writes {}", enabled ? "enabled" : "disabled",
                enabled ? "disabled" : "enabled");
    }

    /**
     * Loads all player records according to the configured mode. Never throws.
     *
     * @return loaded records, possibly partial external data to be normalized by the caller
     */
    public List<PlayerRecord> load() {
        return switch (mode) {
            case FILE -> loadFromFile();
            case DATABASE -> loadFromDatabaseWithoutFallback();
            case AUTO -> loadFromDatabaseWithFallback();
        };
    }

    /**
     * Persists the given collection according to the configured mode.
     *
     * <p>The flat file (FILE and AUTO) is written before this method returns. The relational
     * part (DATABASE and AUTO) is queued; the returned future completes when every row of
     * this call has been written and never completes exceptionally (failures are logged).
     *
     * @param records full player collection
     * @return completion of the relational part, already complete when there is none
     */
    public CompletableFuture<Void> save(List<PlayerRecord> records) {
        if (testMode) {
            log.debug("Skipping save of {} users - test mode active", records.size());
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> relational = CompletableFuture.completedFuture(null);
        if (mode == StorageBackend.DATABASE || mode == StorageBackend.AUTO) {
            relational = saveToDatabase(records);
        }
        if (mode == StorageBackend.FILE || mode == StorageBackend.AUTO) {
            saveToFile(records);
        }
        return relational;
    }

    private List<PlayerRecord> loadFromFile() {
        try {
            if (!fileBackend.exists()) {
                log.info("No users file present, starting with an empty player store");
                return List.of();
            }
            return fileBackend.loadAll();
        } catch (RuntimeException e) {
            log.error("Error loading users from file: {}", e.getMessage(), e);
            return List.of();
        }
    }

    private List<PlayerRecord> loadFromDatabaseWithoutFallback() {
        try {
            return relationalBackend.loadAll().join();
        } catch (RuntimeException e) {
            log.error("Database load failed (no fallback in DATABASE mode): {}", e.getMessage(), e);
            return List.of();
        }
    }

    private List<PlayerRecord> loadFromDatabaseWithFallback() {
        List<PlayerRecord> fromDatabase;
        try {
            fromDatabase = relationalBackend.loadAll().join();
        } catch (RuntimeException e) {
            log.warn("Database load failed, falling back to users file: {}", e.getMessage());
            return loadFromFile();
        }

        if (fromDatabase.isEmpty()) {
            List<PlayerRecord> fromFile = loadFromFile();
            if (!fromFile.isEmpty()) {
                log.info("Database holds no users, using {} users from file", fromFile.size());
                return fromFile;
            }
        }
        return fromDatabase;
    }

    private void saveToFile(List<PlayerRecord> records) {
        try {
            fileBackend.saveAll(records);
        } catch (RuntimeException e) {
            log.error("Error saving users to file: {}", e.getMessage(), e);
        }
    }

    private CompletableFuture<Void> saveToDatabase(List<PlayerRecord> records) {
        CompletableFuture<?>[] writes = new CompletableFuture<?>[records.size()];
        for (int i = 0; i < records.size(); i++) {
            PlayerRecord record = records.get(i);
            CompletableFuture<Void> write;
            try {
                write = relationalBackend.upsertOne(record);
            } catch (RuntimeException e) {
                write = CompletableFuture.failedFuture(e);
            }
            writes[i] = write.exceptionally(error -> {
                log.error("Database save failed for user {}: {}", record.getUsername(), error.getMessage());
                return null;
            });
        }
        return CompletableFuture.allOf(writes);
    }
}
