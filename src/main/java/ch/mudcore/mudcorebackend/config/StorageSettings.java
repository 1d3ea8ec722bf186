package ch.mudcore.mudcorebackend.config;

import ch.mudcore.mudcorebackend.domain.enums.StorageBackend;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Resolved player storage configuration.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code mudcore.storage.backend}: {@code file}, {@code database} or {@code auto} (default: auto)</li>
 *   <li>{@code mudcore.storage.data-dir}: directory holding {@code users.json} (default: ./data)</li>
 *   <li>{@code mudcore.storage.test-mode}: suppress every write (default: false)</li>
 *   <li>{@code mudcore.storage.seed-users}: optional raw JSON array of player records; when set
 *       it replaces the normal load entirely (fixtures, snapshots)</li>
 * </ul>
 */
@Component
@Getter
public class StorageSettings {

    public static final String USERS_FILE_NAME = "users.json";

    private final StorageBackend backend;
    private final Path dataDir;
    private final boolean testMode;
    private final String seedUsers;

    public StorageSettings(@Value("${mudcore.storage.backend:auto}") String backend,
                           @Value("${mudcore.storage.data-dir:./data}") String dataDir,
                           @Value("${mudcore.storage.test-mode:false}") boolean testMode,
                           @Value("${mudcore.storage.seed-users:}") String seedUsers) {
        this.backend = StorageBackend.fromConfig(backend);
        this.dataDir = Path.of(dataDir);
        this.testMode = testMode;
        this.seedUsers = seedUsers;
    }

    public Path getUsersFile() {
        return dataDir.resolve(USERS_FILE_NAME);
    }

    public boolean hasSeedUsers() {
        return seedUsers != null && !seedUsers.isBlank();
    }
}
