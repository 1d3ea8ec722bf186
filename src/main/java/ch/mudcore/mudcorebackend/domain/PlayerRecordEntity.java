package ch.mudcore.mudcorebackend.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Relational row for one {@link PlayerRecord}.
 *
 * <p>The username is the primary key, so {@code save} on an existing username replaces the
 * whole row (insert-or-replace). Collections (equipment, inventory items, flags) and
 * unmodelled extra fields are stored as JSON text columns.
 */
@Entity
@Table(name = "players")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PlayerRecordEntity {

    @Id
    @Column(nullable = false, length = 32)
    private String username;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(nullable = false)
    private String salt;

    /**
     * Plaintext credential of a not yet migrated legacy record.
     */
    @Column(name = "legacy_password")
    private String legacyPassword;

    @Column(nullable = false)
    private int health;

    @Column(name = "max_health", nullable = false)
    private int maxHealth;

    @Column(nullable = false)
    private int mana;

    @Column(name = "max_mana", nullable = false)
    private int maxMana;

    @Column(nullable = false)
    private int experience;

    @Column(nullable = false)
    private int level;

    @Column(nullable = false)
    private int strength;

    @Column(nullable = false)
    private int dexterity;

    @Column(nullable = false)
    private int agility;

    @Column(nullable = false)
    private int constitution;

    @Column(nullable = false)
    private int wisdom;

    @Column(nullable = false)
    private int intelligence;

    @Column(nullable = false)
    private int charisma;

    private Integer attack;

    private Integer defense;

    @Lob
    @Column(name = "equipment")
    private String equipmentJson;

    @Column(name = "join_date", nullable = false)
    private Instant joinDate;

    @Column(name = "last_login", nullable = false)
    private Instant lastLogin;

    @Column(name = "total_play_time")
    private long totalPlayTime;

    @Column(name = "current_room_id", nullable = false)
    private String currentRoomId;

    @Lob
    @Column(name = "inventory_items")
    private String inventoryItemsJson;

    @Column(name = "inventory_gold")
    private int inventoryGold;

    @Column(name = "inventory_silver")
    private int inventorySilver;

    @Column(name = "inventory_copper")
    private int inventoryCopper;

    @Column(name = "bank_gold")
    private int bankGold;

    @Column(name = "bank_silver")
    private int bankSilver;

    @Column(name = "bank_copper")
    private int bankCopper;

    @Column(name = "in_combat")
    private boolean inCombat;

    @Column(name = "is_unconscious")
    private boolean unconscious;

    @Column(name = "is_resting")
    private boolean resting;

    @Column(name = "is_meditating")
    private boolean meditating;

    @Lob
    @Column(name = "flags")
    private String flagsJson;

    private String email;

    @Lob
    private String description;

    @Lob
    @Column(name = "extra_data")
    private String extraJson;

    public PlayerRecordEntity(String username) {
        this.username = username;
    }
}
