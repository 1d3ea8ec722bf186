package ch.mudcore.mudcorebackend.application.service;

import ch.mudcore.mudcorebackend.config.StorageSettings;
import ch.mudcore.mudcorebackend.domain.Currency;
import ch.mudcore.mudcorebackend.domain.Inventory;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.domain.PlayerUpdate;
import ch.mudcore.mudcorebackend.service.auth.PasswordHasher;
import ch.mudcore.mudcorebackend.service.persistence.JsonFilePlayerStore;
import ch.mudcore.mudcorebackend.service.persistence.PersistenceGateway;
import ch.mudcore.mudcorebackend.service.persistence.PlayerStorageException;
import ch.mudcore.mudcorebackend.service.user.UserStore;
import ch.mudcore.mudcorebackend.testutil.PlayerFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link UserStore}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Registration: username rules, duplicates, default stats</li>
 *   <li>Partial updates, flag handling and play time accounting</li>
 *   <li>Bulk load: validation before mutation, backfill, legacy password migration</li>
 *   <li>Every mutation triggers exactly one persistence write</li>
 * </ul>
 *
 * <p>Notes:
 * <ul>
 *   <li>{@link PersistenceGateway} is mocked; tests only verify that saves were requested</li>
 *   <li>Snapshot import/export uses a real {@link JsonFilePlayerStore} on a temp directory</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class UserStoreTest {

    @Mock
    private PersistenceGateway persistenceGateway;

    @TempDir
    Path tempDir;

    private final PasswordHasher hasher = new PasswordHasher(1000);
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private UserStore userStore;

    @BeforeEach
    void setUp() {
        lenient().when(persistenceGateway.save(anyList())).thenReturn(CompletableFuture.completedFuture(null));
        userStore = newStore("");
    }

    private UserStore newStore(String seedUsers) {
        StorageSettings settings = new StorageSettings("file", tempDir.toString(), false, seedUsers);
        JsonFilePlayerStore fileStore = new JsonFilePlayerStore(objectMapper, settings);
        return new UserStore(persistenceGateway, hasher, fileStore, objectMapper, settings);
    }

    // ------------------------------------------------------------------------------------
    // createUser
    // ------------------------------------------------------------------------------------

    @Test
    void createUser_shouldStoreLowerCaseRecordWithDefaults() {
        // Act
        boolean created = userStore.createUser("Alice", "secret");

        // Assert
        assertThat(created).isTrue();
        PlayerRecord alice = userStore.getUser("ALICE").orElseThrow();
        assertThat(alice.getUsername()).isEqualTo("alice");
        assertThat(alice.getHealth()).isEqualTo(100);
        assertThat(alice.getMaxHealth()).isEqualTo(100);
        assertThat(alice.getMana()).isEqualTo(100);
        assertThat(alice.getMaxMana()).isEqualTo(100);
        assertThat(alice.getLevel()).isEqualTo(1);
        assertThat(alice.getExperience()).isZero();
        assertThat(alice.getStrength()).isEqualTo(10);
        assertThat(alice.getCharisma()).isEqualTo(10);
        assertThat(alice.getAttack()).isEqualTo(5);
        assertThat(alice.getDefense()).isEqualTo(5);
        assertThat(alice.getCurrentRoomId()).isEqualTo("start");
        assertThat(alice.getInventory().getItems()).isEmpty();
        assertThat(alice.getInventory().getCurrency()).isEqualTo(new Currency(0, 0, 0));
        assertThat(alice.getTotalPlayTime()).isZero();
        assertThat(alice.getJoinDate()).isEqualTo(alice.getLastLogin());
        assertThat(alice.getPassword()).isNull();
        assertThat(hasher.verify("secret", alice.getPasswordHash(), alice.getSalt())).isTrue();

        verify(persistenceGateway, times(1)).save(anyList());
    }

    @Test
    void createUser_shouldRejectInvalidUsernames() {
        assertThat(userStore.createUser("al", "pw")).isFalse();
        assertThat(userStore.createUser("abcdefghijklm", "pw")).isFalse();
        assertThat(userStore.createUser("al1ce", "pw")).isFalse();
        assertThat(userStore.createUser("al ice", "pw")).isFalse();
        assertThat(userStore.createUser("", "pw")).isFalse();

        assertThat(userStore.size()).isZero();
        verify(persistenceGateway, never()).save(anyList());
    }

    @Test
    void createUser_shouldAcceptBoundaryLengths() {
        assertThat(userStore.createUser("abc", "pw")).isTrue();
        assertThat(userStore.createUser("abcdefghijkl", "pw")).isTrue();
    }

    @Test
    void createUser_shouldRejectDuplicate_caseInsensitive() {
        assertThat(userStore.createUser("alice", "pw")).isTrue();

        assertThat(userStore.createUser("ALICE", "other")).isFalse();
        assertThat(userStore.size()).isEqualTo(1);
    }

    // ------------------------------------------------------------------------------------
    // updateUserStats
    // ------------------------------------------------------------------------------------

    @Test
    void updateUserStats_shouldMergePatchAndPersist() {
        // Arrange
        userStore.createUser("alice", "pw");

        // Act
        boolean updated = userStore.updateUserStats("Alice", PlayerUpdate.builder().health(50).build());

        // Assert
        assertThat(updated).isTrue();
        PlayerRecord alice = userStore.getUser("alice").orElseThrow();
        assertThat(alice.getHealth()).isEqualTo(50);
        assertThat(alice.getMaxHealth()).isEqualTo(100);
        verify(persistenceGateway, times(2)).save(anyList());
    }

    @Test
    void updateUserStats_shouldReturnFalse_andCreateNothing_whenUserUnknown() {
        boolean updated = userStore.updateUserStats("ghost", PlayerUpdate.builder().health(1).build());

        assertThat(updated).isFalse();
        assertThat(userStore.userExists("ghost")).isFalse();
        verify(persistenceGateway, never()).save(anyList());
    }

    @Test
    void updateUserStats_shouldReplaceFlags() {
        userStore.createUser("alice", "pw");
        userStore.addFlag("alice", "old");

        userStore.updateUserStats("alice", PlayerUpdate.builder().flags(List.of("a", "b")).build());

        assertThat(userStore.getFlags("alice")).contains(List.of("a", "b"));
    }

    @Test
    void updateUserStats_shouldClampMana_whenMaxManaLowered() {
        userStore.createUser("alice", "pw");

        userStore.updateUserStats("alice", PlayerUpdate.builder().maxMana(40).build());
        assertThat(userStore.getUser("alice").orElseThrow().getMana()).isEqualTo(40);

        userStore.updateUserStats("alice", PlayerUpdate.builder().mana(-5).build());
        assertThat(userStore.getUser("alice").orElseThrow().getMana()).isZero();
    }

    // ------------------------------------------------------------------------------------
    // flags, play time, inventory, delete
    // ------------------------------------------------------------------------------------

    @Test
    void addFlag_shouldOnlyAddOnce() {
        userStore.createUser("alice", "pw");

        assertThat(userStore.addFlag("alice", "admin")).isTrue();
        assertThat(userStore.addFlag("alice", "admin")).isFalse();

        assertThat(userStore.hasFlag("alice", "admin")).isTrue();
        assertThat(userStore.getFlags("alice")).contains(List.of("admin"));
    }

    @Test
    void removeFlag_shouldReturnFalse_whenFlagMissing() {
        userStore.createUser("alice", "pw");
        userStore.addFlag("alice", "admin");

        assertThat(userStore.removeFlag("alice", "admin")).isTrue();
        assertThat(userStore.removeFlag("alice", "admin")).isFalse();
        assertThat(userStore.hasFlag("alice", "admin")).isFalse();
    }

    @Test
    void flagOperations_shouldFail_whenUserUnknown() {
        assertThat(userStore.addFlag("ghost", "x")).isFalse();
        assertThat(userStore.removeFlag("ghost", "x")).isFalse();
        assertThat(userStore.hasFlag("ghost", "x")).isFalse();
        assertThat(userStore.getFlags("ghost")).isEmpty();
    }

    @Test
    void updateTotalPlayTime_shouldAccumulate_andIgnoreNegativeAmounts() {
        userStore.createUser("alice", "pw");

        userStore.updateTotalPlayTime("alice", 120);
        userStore.updateTotalPlayTime("alice", 30);
        userStore.updateTotalPlayTime("alice", -500);

        assertThat(userStore.getUser("alice").orElseThrow().getTotalPlayTime()).isEqualTo(150L);
    }

    @Test
    void updateUserInventory_shouldReplaceInventory() {
        userStore.createUser("alice", "pw");
        Inventory inventory = new Inventory(new ArrayList<>(List.of("sword-1")), new Currency(1, 2, 3));

        assertThat(userStore.updateUserInventory("alice", inventory)).isTrue();

        assertThat(userStore.getUser("alice").orElseThrow().getInventory().getItems()).containsExactly("sword-1");
    }

    @Test
    void updateUser_shouldKeepStoredUsername() {
        userStore.createUser("alice", "pw");
        PlayerRecord replacement = PlayerFixtures.player("mallory");
        replacement.setLevel(7);

        assertThat(userStore.updateUser("alice", replacement)).isTrue();

        PlayerRecord stored = userStore.getUser("alice").orElseThrow();
        assertThat(stored.getUsername()).isEqualTo("alice");
        assertThat(stored.getLevel()).isEqualTo(7);
        assertThat(userStore.userExists("mallory")).isFalse();
    }

    @Test
    void deleteUser_shouldRemoveRecord() {
        userStore.createUser("alice", "pw");

        assertThat(userStore.deleteUser("ALICE")).isTrue();
        assertThat(userStore.deleteUser("alice")).isFalse();
        assertThat(userStore.userExists("alice")).isFalse();
    }

    @Test
    void getAllUsers_shouldReturnDefensiveCopy() {
        userStore.createUser("alice", "pw");

        List<PlayerRecord> users = userStore.getAllUsers();
        users.clear();

        assertThat(userStore.getAllUsers()).hasSize(1);
    }

    // ------------------------------------------------------------------------------------
    // loadPrevalidatedUsers
    // ------------------------------------------------------------------------------------

    @Test
    void loadPrevalidatedUsers_shouldBackfillAndMigrate_andPersist() {
        // Arrange
        PlayerRecord legacy = PlayerFixtures.legacyPlayer("Bob", "hunter");

        // Act
        userStore.loadPrevalidatedUsers(new ArrayList<>(List.of(legacy)));

        // Assert
        PlayerRecord bob = userStore.getUser("bob").orElseThrow();
        assertThat(bob.getUsername()).isEqualTo("bob");
        assertThat(bob.getPassword()).isNull();
        assertThat(hasher.verify("hunter", bob.getPasswordHash(), bob.getSalt())).isTrue();
        assertThat(bob.getJoinDate()).isNotNull();
        assertThat(bob.getLastLogin()).isNotNull();
        assertThat(bob.getInventory().getItems()).isEmpty();
        assertThat(bob.getInventory().getCurrency()).isEqualTo(new Currency(0, 0, 0));
        assertThat(bob.getTotalPlayTime()).isZero();
        assertThat(bob.getMana()).isEqualTo(100);
        assertThat(bob.getCurrentRoomId()).isEqualTo("start");

        verify(persistenceGateway, times(1)).save(anyList());
    }

    @Test
    void loadPrevalidatedUsers_shouldNotPersist_whenNothingChanged() {
        userStore.loadPrevalidatedUsers(List.of(PlayerFixtures.player("alice"), PlayerFixtures.player("bob")));

        assertThat(userStore.size()).isEqualTo(2);
        verify(persistenceGateway, never()).save(anyList());
    }

    @Test
    void loadPrevalidatedUsers_shouldThrowAndKeepStore_whenDuplicateUsername() {
        // Arrange
        userStore.createUser("carol", "pw");
        List<PlayerRecord> incoming = List.of(PlayerFixtures.player("alice"), PlayerFixtures.player("ALICE"));

        // Act + Assert
        assertThatThrownBy(() -> userStore.loadPrevalidatedUsers(incoming))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alice");

        assertThat(userStore.userExists("carol")).isTrue();
        assertThat(userStore.userExists("alice")).isFalse();
    }

    @Test
    void loadPrevalidatedUsers_shouldThrow_whenUsernameInvalid() {
        List<PlayerRecord> incoming = List.of(PlayerFixtures.player("x1"));

        assertThatThrownBy(() -> userStore.loadPrevalidatedUsers(incoming))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(userStore.size()).isZero();
    }

    @Test
    void loadPrevalidatedUsers_shouldClampOutOfRangeMana() {
        PlayerRecord record = PlayerFixtures.player("alice");
        record.setMaxMana(30);
        record.setMana(90);

        userStore.loadPrevalidatedUsers(List.of(record));

        assertThat(userStore.getUser("alice").orElseThrow().getMana()).isEqualTo(30);
    }

    // ------------------------------------------------------------------------------------
    // reload, snapshots
    // ------------------------------------------------------------------------------------

    @Test
    void reload_shouldUseSeedUsers_andSkipStorage() {
        UserStore seeded = newStore("[{\"username\":\"Dora\",\"password\":\"pw\"}]");

        seeded.reload();

        assertThat(seeded.userExists("dora")).isTrue();
        verify(persistenceGateway, never()).load();
    }

    @Test
    void reload_shouldLoadFromGateway_whenNoSeed() {
        when(persistenceGateway.load()).thenReturn(new ArrayList<>(List.of(PlayerFixtures.player("alice"))));

        userStore.reload();

        assertThat(userStore.userExists("alice")).isTrue();
    }

    @Test
    void saveToPath_thenLoadFromPath_shouldRestoreSnapshot() {
        // Arrange
        userStore.createUser("alice", "pw");
        userStore.addFlag("alice", "admin");
        Path snapshot = tempDir.resolve("snapshots/users-backup.json");

        // Act
        int written = userStore.saveToPath(snapshot);
        userStore.deleteUser("alice");
        userStore.loadFromPath(snapshot);

        // Assert
        assertThat(written).isEqualTo(1);
        assertThat(userStore.hasFlag("alice", "admin")).isTrue();
    }

    @Test
    void loadFromPath_shouldThrow_whenFileMissing() {
        assertThatThrownBy(() -> userStore.loadFromPath(tempDir.resolve("missing.json")))
                .isInstanceOf(PlayerStorageException.class);
    }
}
