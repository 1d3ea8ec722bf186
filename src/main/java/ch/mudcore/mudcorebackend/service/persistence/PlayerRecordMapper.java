package ch.mudcore.mudcorebackend.service.persistence;

import ch.mudcore.mudcorebackend.domain.Currency;
import ch.mudcore.mudcorebackend.domain.Inventory;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.domain.PlayerRecordEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between the in-memory {@link PlayerRecord} and its relational row.
 *
 * <p>Collection fields are serialized to JSON text with the application's
 * {@link ObjectMapper}. Missing values are written with the same defaults the relational
 * schema declares (empty credential, zero currency, start room).
 */
@Component
public class PlayerRecordMapper {

    private static final TypeReference<Map<String, String>> EQUIPMENT_TYPE = new TypeReference<>() { };
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() { };
    private static final TypeReference<Map<String, Object>> EXTRA_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public PlayerRecordMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PlayerRecordEntity toEntity(PlayerRecord record) {
        PlayerRecordEntity entity = new PlayerRecordEntity(record.getUsername());
        entity.setPasswordHash(record.getPasswordHash() == null ? "" : record.getPasswordHash());
        entity.setSalt(record.getSalt() == null ? "" : record.getSalt());
        entity.setLegacyPassword(record.getPassword());

        entity.setHealth(record.getHealth());
        entity.setMaxHealth(record.getMaxHealth());
        entity.setMana(record.getMana() == null ? record.getMaxMana() : record.getMana());
        entity.setMaxMana(record.getMaxMana());
        entity.setExperience(record.getExperience());
        entity.setLevel(record.getLevel());
        entity.setStrength(record.getStrength());
        entity.setDexterity(record.getDexterity());
        entity.setAgility(record.getAgility());
        entity.setConstitution(record.getConstitution());
        entity.setWisdom(record.getWisdom());
        entity.setIntelligence(record.getIntelligence());
        entity.setCharisma(record.getCharisma());
        entity.setAttack(record.getAttack());
        entity.setDefense(record.getDefense());

        entity.setEquipmentJson(writeJson(record.getEquipment()));
        Instant now = Instant.now();
        entity.setJoinDate(record.getJoinDate() == null ? now : record.getJoinDate());
        entity.setLastLogin(record.getLastLogin() == null ? now : record.getLastLogin());
        entity.setTotalPlayTime(record.getTotalPlayTime() == null ? 0L : record.getTotalPlayTime());
        entity.setCurrentRoomId(record.getCurrentRoomId() == null ? "start" : record.getCurrentRoomId());

        Inventory inventory = record.getInventory();
        if (inventory != null) {
            entity.setInventoryItemsJson(writeJson(inventory.getItems()));
            Currency purse = inventory.getCurrency();
            if (purse != null) {
                entity.setInventoryGold(purse.getGold());
                entity.setInventorySilver(purse.getSilver());
                entity.setInventoryCopper(purse.getCopper());
            }
        }
        Currency bank = record.getBank();
        if (bank != null) {
            entity.setBankGold(bank.getGold());
            entity.setBankSilver(bank.getSilver());
            entity.setBankCopper(bank.getCopper());
        }

        entity.setInCombat(record.isInCombat());
        entity.setUnconscious(record.isUnconscious());
        entity.setResting(record.isResting());
        entity.setMeditating(record.isMeditating());
        entity.setFlagsJson(writeJson(record.getFlags()));
        entity.setEmail(record.getEmail());
        entity.setDescription(record.getDescription());
        entity.setExtraJson(record.getExtra().isEmpty() ? null : writeJson(record.getExtra()));
        return entity;
    }

    public PlayerRecord toRecord(PlayerRecordEntity entity) {
        PlayerRecord record = new PlayerRecord(entity.getUsername());
        record.setPasswordHash(emptyToNull(entity.getPasswordHash()));
        record.setSalt(emptyToNull(entity.getSalt()));
        record.setPassword(entity.getLegacyPassword());

        record.setHealth(entity.getHealth());
        record.setMaxHealth(entity.getMaxHealth());
        record.setMaxMana(entity.getMaxMana());
        record.setMana(entity.getMana());
        record.setExperience(entity.getExperience());
        record.setLevel(entity.getLevel());
        record.setStrength(entity.getStrength());
        record.setDexterity(entity.getDexterity());
        record.setAgility(entity.getAgility());
        record.setConstitution(entity.getConstitution());
        record.setWisdom(entity.getWisdom());
        record.setIntelligence(entity.getIntelligence());
        record.setCharisma(entity.getCharisma());
        record.setAttack(entity.getAttack());
        record.setDefense(entity.getDefense());

        Map<String, String> equipment = readJson(entity.getEquipmentJson(), EQUIPMENT_TYPE);
        record.setEquipment(equipment == null ? new LinkedHashMap<>() : equipment);
        record.setJoinDate(entity.getJoinDate());
        record.setLastLogin(entity.getLastLogin());
        record.setTotalPlayTime(entity.getTotalPlayTime());
        record.setCurrentRoomId(entity.getCurrentRoomId());

        List<String> items = readJson(entity.getInventoryItemsJson(), STRING_LIST_TYPE);
        record.setInventory(new Inventory(
                items == null ? new ArrayList<>() : items,
                new Currency(entity.getInventoryGold(), entity.getInventorySilver(), entity.getInventoryCopper())
        ));
        record.setBank(new Currency(entity.getBankGold(), entity.getBankSilver(), entity.getBankCopper()));

        record.setInCombat(entity.isInCombat());
        record.setUnconscious(entity.isUnconscious());
        record.setResting(entity.isResting());
        record.setMeditating(entity.isMeditating());
        record.setFlags(readJson(entity.getFlagsJson(), STRING_LIST_TYPE));
        record.setEmail(entity.getEmail());
        record.setDescription(entity.getDescription());

        Map<String, Object> extra = readJson(entity.getExtraJson(), EXTRA_TYPE);
        if (extra != null) {
            extra.forEach(record::putExtra);
        }
        return record;
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PlayerStorageException("Failed to serialize column value", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PlayerStorageException("Failed to parse column value", e);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
