package ch.mudcore.mudcorebackend.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Items carried by a player plus the coins in their purse.
 *
 * <p>{@code items} holds item <em>instance</em> ids, never embedded item data.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class Inventory {

    private List<String> items = new ArrayList<>();

    private Currency currency = Currency.empty();

    public static Inventory empty() {
        return new Inventory(new ArrayList<>(), Currency.empty());
    }

    public Inventory copy() {
        return new Inventory(
                items == null ? new ArrayList<>() : new ArrayList<>(items),
                currency == null ? Currency.empty() : currency.copy()
        );
    }
}
