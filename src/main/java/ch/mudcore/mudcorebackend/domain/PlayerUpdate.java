package ch.mudcore.mudcorebackend.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial update of a {@link PlayerRecord}.
 *
 * <p>Every field is optional; {@code null} leaves the record's value untouched.
 * {@code flags} replaces the whole flag list when present (it is not merged).
 * The username can never be changed through a patch.
 */
@Getter
@Builder
@Jacksonized
public class PlayerUpdate {

    private final Integer health;
    private final Integer maxHealth;
    private final Integer mana;
    private final Integer maxMana;
    private final Integer experience;
    private final Integer level;

    private final Integer strength;
    private final Integer dexterity;
    private final Integer agility;
    private final Integer constitution;
    private final Integer wisdom;
    private final Integer intelligence;
    private final Integer charisma;
    private final Integer attack;
    private final Integer defense;

    private final String currentRoomId;
    private final Map<String, String> equipment;
    private final Inventory inventory;
    private final Currency bank;
    private final List<String> flags;

    private final Boolean inCombat;
    private final Boolean unconscious;
    private final Boolean resting;
    private final Boolean meditating;

    private final Instant lastLogin;
    private final String email;
    private final String description;

    /**
     * Applies the non-null fields of this patch to {@code target} and re-clamps mana.
     *
     * @param target record to mutate
     */
    public void applyTo(PlayerRecord target) {
        if (health != null) target.setHealth(health);
        if (maxHealth != null) target.setMaxHealth(maxHealth);
        if (maxMana != null) target.setMaxMana(maxMana);
        if (mana != null) target.setMana(mana);
        if (experience != null) target.setExperience(experience);
        if (level != null) target.setLevel(level);

        if (strength != null) target.setStrength(strength);
        if (dexterity != null) target.setDexterity(dexterity);
        if (agility != null) target.setAgility(agility);
        if (constitution != null) target.setConstitution(constitution);
        if (wisdom != null) target.setWisdom(wisdom);
        if (intelligence != null) target.setIntelligence(intelligence);
        if (charisma != null) target.setCharisma(charisma);
        if (attack != null) target.setAttack(attack);
        if (defense != null) target.setDefense(defense);

        if (currentRoomId != null) target.setCurrentRoomId(currentRoomId);
        if (equipment != null) target.setEquipment(new LinkedHashMap<>(equipment));
        if (inventory != null) target.setInventory(inventory.copy());
        if (bank != null) target.setBank(bank.copy());
        if (flags != null) target.setFlags(new ArrayList<>(flags));

        if (inCombat != null) target.setInCombat(inCombat);
        if (unconscious != null) target.setUnconscious(unconscious);
        if (resting != null) target.setResting(resting);
        if (meditating != null) target.setMeditating(meditating);

        if (lastLogin != null) target.setLastLogin(lastLogin);
        if (email != null) target.setEmail(email);
        if (description != null) target.setDescription(description);

        target.clampMana();
    }
}
