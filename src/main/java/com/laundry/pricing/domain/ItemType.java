package com.laundry.pricing.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Item types a customer can order, keyed by the names used on the wire.
 * Special items are priced per unit and never go into a pack.
 */
public enum ItemType {
    GENERIC("peca_variada", false),
    SHIRT("camisa", false),
    SIMPLE_DRESS("vestido_simples", true),
    ORNAMENTED_DRESS("vestido_frisado", true),
    SUIT("fato", true),
    COAT("casaco", true),
    TOWEL("toalha", true),
    SHEET("lencol", false);

    private final String key;
    private final boolean special;

    ItemType(String key, boolean special) {
        this.key = key;
        this.special = special;
    }

    public String getKey() {
        return key;
    }

    public boolean isSpecial() {
        return special;
    }

    public static Optional<ItemType> fromKey(String key) {
        return Arrays.stream(values())
                .filter(t -> t.key.equals(key))
                .findFirst();
    }
}
