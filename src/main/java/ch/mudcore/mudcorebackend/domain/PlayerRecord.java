package ch.mudcore.mudcorebackend.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical record of a registered player.
 *
 * <p>The record is the unit of persistence: the flat backend stores an array of these
 * (serialized by Jackson, see {@code JsonFilePlayerStore}), the relational backend keeps one
 * row per record (see {@code PlayerRecordEntity}).
 *
 * <p>Invariants maintained by {@code UserStore}:
 * <ul>
 *   <li>{@code username} is lower-case, unique and never changes after creation</li>
 *   <li>{@code mana} stays within {@code [0, maxMana]} (see {@link #clampMana()})</li>
 *   <li>a record carries either {@code passwordHash}+{@code salt} or a legacy plaintext
 *       {@code password} that is migrated on first successful login or bulk load</li>
 * </ul>
 *
 * <p>Fields the backend does not model (race, class, command history, ...) are kept in
 * {@link #getExtra()} so that a load/save round trip does not drop them.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlayerRecord {

    @Setter(AccessLevel.NONE)
    private String username;

    /**
     * Legacy plaintext credential. Only present on records imported from old data files.
     */
    private String password;

    private String passwordHash;
    private String salt;

    private int health = 100;
    private int maxHealth = 100;

    /**
     * Nullable only until bulk load backfills it from {@link #maxMana}.
     */
    private Integer mana;
    private int maxMana = 100;

    private int experience;
    private int level = 1;

    private int strength = 10;
    private int dexterity = 10;
    private int agility = 10;
    private int constitution = 10;
    private int wisdom = 10;
    private int intelligence = 10;
    private int charisma = 10;

    private Integer attack;
    private Integer defense;

    /**
     * Slot name -> item instance id.
     */
    private Map<String, String> equipment = new LinkedHashMap<>();

    private Instant joinDate;
    private Instant lastLogin;

    /**
     * Accumulated play time in seconds. Only ever grows.
     */
    private Long totalPlayTime;

    private String currentRoomId;

    private Inventory inventory;
    private Currency bank;

    private List<String> flags;

    private boolean inCombat;

    @JsonProperty("isUnconscious")
    private boolean unconscious;

    @JsonProperty("isResting")
    private boolean resting;

    @JsonProperty("isMeditating")
    private boolean meditating;

    private String email;
    private String description;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra = new LinkedHashMap<>();

    public PlayerRecord(String username) {
        this.username = username;
    }

    /**
     * Used by bulk load to store the normalized form of an imported username.
     */
    public void normalizeUsername(String normalized) {
        this.username = normalized;
    }

    @JsonProperty("username")
    private void setUsernameFromJson(String username) {
        this.username = username;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    /**
     * Whether this record still carries a plaintext credential awaiting migration.
     */
    @JsonIgnore
    public boolean hasLegacyPassword() {
        return password != null && !password.isEmpty();
    }

    /**
     * Forces {@code mana} into {@code [0, maxMana]}; a missing value becomes {@code maxMana}.
     *
     * @return {@code true} if the value changed
     */
    public boolean clampMana() {
        if (maxMana < 0) {
            maxMana = 0;
        }
        int before = mana == null ? Integer.MIN_VALUE : mana;
        int clamped = mana == null ? maxMana : Math.max(0, Math.min(mana, maxMana));
        mana = clamped;
        return before != clamped;
    }

    /**
     * Deep value copy. Mutating the copy never affects this record and vice versa.
     */
    public PlayerRecord copy() {
        PlayerRecord copy = new PlayerRecord(username);
        copy.password = password;
        copy.passwordHash = passwordHash;
        copy.salt = salt;
        copy.health = health;
        copy.maxHealth = maxHealth;
        copy.mana = mana;
        copy.maxMana = maxMana;
        copy.experience = experience;
        copy.level = level;
        copy.strength = strength;
        copy.dexterity = dexterity;
        copy.agility = agility;
        copy.constitution = constitution;
        copy.wisdom = wisdom;
        copy.intelligence = intelligence;
        copy.charisma = charisma;
        copy.attack = attack;
        copy.defense = defense;
        copy.equipment = equipment == null ? null : new LinkedHashMap<>(equipment);
        copy.joinDate = joinDate;
        copy.lastLogin = lastLogin;
        copy.totalPlayTime = totalPlayTime;
        copy.currentRoomId = currentRoomId;
        copy.inventory = inventory == null ? null : inventory.copy();
        copy.bank = bank == null ? null : bank.copy();
        copy.flags = flags == null ? null : new ArrayList<>(flags);
        copy.inCombat = inCombat;
        copy.unconscious = unconscious;
        copy.resting = resting;
        copy.meditating = meditating;
        copy.email = email;
        copy.description = description;
        copy.extra = copyExtra(extra);
        return copy;
    }

    private static Map<String, Object> copyExtra(Map<?, ?> source) {
        Map<String, Object> target = new LinkedHashMap<>();
        source.forEach((key, value) -> target.put(String.valueOf(key), copyExtraValue(value)));
        return target;
    }

    /**
     * Unmodelled fields hold what Jackson produced: maps, lists and immutable scalars.
     */
    private static Object copyExtraValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyExtra(map);
        }
        if (value instanceof List<?> list) {
            List<Object> target = new ArrayList<>(list.size());
            list.forEach(element -> target.add(copyExtraValue(element)));
            return target;
        }
        return value;
    }

    /**
     * Creates a freshly registered player with the default starting stats.
     *
     * @param username normalized username
     * @param credential hashed password
     * @param now registration instant
     * @return new record
     */
    public static PlayerRecord newPlayer(String username, HashedPassword credential, Instant now) {
        PlayerRecord record = new PlayerRecord(username);
        record.passwordHash = credential.hash();
        record.salt = credential.salt();
        record.mana = record.maxMana;
        record.attack = 5;
        record.defense = 5;
        record.joinDate = now;
        record.lastLogin = now;
        record.totalPlayTime = 0L;
        record.currentRoomId = "start";
        record.inventory = Inventory.empty();
        return record;
    }
}
