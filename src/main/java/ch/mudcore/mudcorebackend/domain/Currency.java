package ch.mudcore.mudcorebackend.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Coin purse split into three integer denominations.
 *
 * <p>Used for the carried inventory currency and the bank balance. Persisted as
 * {@code {"gold": .., "silver": .., "copper": ..}} in the flat file and as three
 * integer columns in the relational store.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class Currency {

    private int gold;
    private int silver;
    private int copper;

    public static Currency empty() {
        return new Currency(0, 0, 0);
    }

    public Currency copy() {
        return new Currency(gold, silver, copper);
    }
}
