package com.laundry.pricing.domain;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized customer order: every recognized item type mapped to a non-negative quantity.
 */
@Value
public class LaundryOrder {

    /**
     * Largest quantity accepted per item type. The solver's feasibility tolerance is relative,
     * and well below this bound it cannot round away an uncovered item.
     */
    public static final int MAX_QUANTITY = 100_000;

    Map<ItemType, Integer> quantities;

    private LaundryOrder(Map<ItemType, Integer> quantities) {
        this.quantities = Collections.unmodifiableMap(quantities);
    }

    /**
     * Builds an order from raw wire keys. Missing item types count as zero.
     *
     * @throws OrderValidationException if a key is not a recognized item type or a quantity is
     *                                  negative or above {@link #MAX_QUANTITY}
     */
    public static LaundryOrder fromItems(Map<String, Integer> items) {
        if (items == null) {
            throw new OrderValidationException("Order items are required", List.of());
        }

        List<String> unknown = new ArrayList<>();
        List<String> negative = new ArrayList<>();
        List<String> tooLarge = new ArrayList<>();
        EnumMap<ItemType, Integer> quantities = new EnumMap<>(ItemType.class);
        for (ItemType type : ItemType.values()) {
            quantities.put(type, 0);
        }

        items.forEach((key, qty) -> {
            Optional<ItemType> type = ItemType.fromKey(key);
            if (type.isEmpty()) {
                unknown.add(key);
            } else if (qty == null || qty < 0) {
                negative.add(key);
            } else if (qty > MAX_QUANTITY) {
                tooLarge.add(key);
            } else {
                quantities.put(type.get(), qty);
            }
        });

        if (!unknown.isEmpty()) {
            throw new OrderValidationException("Unknown item types: " + unknown, unknown);
        }
        if (!negative.isEmpty()) {
            throw new OrderValidationException("Quantities must be non-negative integers: " + negative, negative);
        }
        if (!tooLarge.isEmpty()) {
            throw new OrderValidationException("Quantities above " + MAX_QUANTITY + " per item type are not accepted: "
                    + tooLarge, tooLarge);
        }
        return new LaundryOrder(quantities);
    }

    public static LaundryOrder of(Map<ItemType, Integer> quantities) {
        Map<String, Integer> items = new LinkedHashMap<>();
        quantities.forEach((type, qty) -> items.put(type.getKey(), qty));
        return fromItems(items);
    }

    public int quantity(ItemType type) {
        return quantities.get(type);
    }

    /**
     * Wire-keyed view, used for logging.
     */
    public Map<String, Integer> toItems() {
        Map<String, Integer> items = new LinkedHashMap<>();
        quantities.forEach((type, qty) -> items.put(type.getKey(), qty));
        return items;
    }
}
