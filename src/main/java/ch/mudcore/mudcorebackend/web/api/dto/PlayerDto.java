package ch.mudcore.mudcorebackend.web.api.dto;

import ch.mudcore.mudcorebackend.domain.Currency;
import ch.mudcore.mudcorebackend.domain.Inventory;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * DTO representing a player record in an admin-safe form.
 *
 * <p>Credentials (hash, salt, legacy password) are never exposed.
 *
 * @param username normalized username
 * @param online whether the player currently has a bound session
 * @param level current level
 * @param experience accumulated experience
 * @param health current health
 * @param maxHealth maximum health
 * @param mana current mana
 * @param maxMana maximum mana
 * @param attributes the seven base attributes by name
 * @param attack attack rating, may be null
 * @param defense defense rating, may be null
 * @param currentRoomId room the player is in
 * @param equipment slot to item instance id
 * @param inventory carried items and currency
 * @param bank banked currency, may be null
 * @param flags player flags in insertion order
 * @param inCombat whether the player was last seen in combat
 * @param joinDate registration instant
 * @param lastLogin last successful login
 * @param totalPlayTime accumulated play time in seconds
 */
public record PlayerDto(
        String username,
        boolean online,
        int level,
        int experience,
        int health,
        int maxHealth,
        Integer mana,
        int maxMana,
        Map<String, Integer> attributes,
        Integer attack,
        Integer defense,
        String currentRoomId,
        Map<String, String> equipment,
        Inventory inventory,
        Currency bank,
        List<String> flags,
        boolean inCombat,
        Instant joinDate,
        Instant lastLogin,
        Long totalPlayTime
) {

    /**
     * Creates a {@code PlayerDto} from the given record.
     *
     * @param record player record
     * @param online whether the player has a live session
     * @return mapped DTO
     */
    public static PlayerDto from(PlayerRecord record, boolean online) {
        Map<String, Integer> attributes = Map.of(
                "strength", record.getStrength(),
                "dexterity", record.getDexterity(),
                "agility", record.getAgility(),
                "constitution", record.getConstitution(),
                "wisdom", record.getWisdom(),
                "intelligence", record.getIntelligence(),
                "charisma", record.getCharisma()
        );
        return new PlayerDto(
                record.getUsername(),
                online,
                record.getLevel(),
                record.getExperience(),
                record.getHealth(),
                record.getMaxHealth(),
                record.getMana(),
                record.getMaxMana(),
                attributes,
                record.getAttack(),
                record.getDefense(),
                record.getCurrentRoomId(),
                record.getEquipment() == null ? Map.of() : Map.copyOf(record.getEquipment()),
                record.getInventory() == null ? null : record.getInventory().copy(),
                record.getBank() == null ? null : record.getBank().copy(),
                record.getFlags() == null ? List.of() : List.copyOf(record.getFlags()),
                record.isInCombat(),
                record.getJoinDate(),
                record.getLastLogin(),
                record.getTotalPlayTime()
        );
    }
}
