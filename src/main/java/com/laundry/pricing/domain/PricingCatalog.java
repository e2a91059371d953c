package com.laundry.pricing.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only pack catalog and unit price list.
 * Built once and shared between requests; the constructor rejects inconsistent data.
 */
@Value
public class PricingCatalog {

    List<MixedPack> mixedPacks;
    List<FamilyPack> shirtPacks;
    List<FamilyPack> sheetPacks;
    Map<ItemType, Double> unitPrices;

    @Builder
    private PricingCatalog(@Singular List<MixedPack> mixedPacks,
                           @Singular List<FamilyPack> shirtPacks,
                           @Singular List<FamilyPack> sheetPacks,
                           @Singular Map<ItemType, Double> unitPrices) {
        this.mixedPacks = List.copyOf(mixedPacks);
        this.shirtPacks = List.copyOf(shirtPacks);
        this.sheetPacks = List.copyOf(sheetPacks);
        EnumMap<ItemType, Double> prices = new EnumMap<>(ItemType.class);
        prices.putAll(unitPrices);
        this.unitPrices = Collections.unmodifiableMap(prices);
        validate();
    }

    public double unitPrice(ItemType type) {
        return unitPrices.get(type);
    }

    /**
     * Packs and prices of the shop's current price list.
     */
    public static PricingCatalog standard() {
        return PricingCatalog.builder()
                .mixedPack(mixed("20", 20, 2, 10.0))
                .mixedPack(mixed("40", 40, 4, 20.0))
                .mixedPack(mixed("60", 60, 5, 30.0))
                .mixedPack(mixed("80", 80, 5, 37.5))
                .mixedPack(mixed("100", 100, 6, 45.0))
                .mixedPack(mixed("150", 150, 6, 65.0))
                .mixedPack(mixed("200", 200, 7, 85.0))
                .shirtPack(family("10", 10, 7.5))
                .shirtPack(family("20", 20, 14.0))
                .shirtPack(family("50", 50, 37.5))
                .sheetPack(family("10", 10, 9.5))
                .sheetPack(family("20", 20, 18.0))
                .unitPrice(ItemType.GENERIC, 0.80)
                .unitPrice(ItemType.SHIRT, 0.75)
                .unitPrice(ItemType.SIMPLE_DRESS, 7.0)
                .unitPrice(ItemType.ORNAMENTED_DRESS, 12.5)
                .unitPrice(ItemType.SUIT, 5.5)
                .unitPrice(ItemType.COAT, 3.5)
                .unitPrice(ItemType.TOWEL, 3.5)
                .unitPrice(ItemType.SHEET, 1.0)
                .build();
    }

    private static MixedPack mixed(String label, int capacity, int shirtLimit, double price) {
        return MixedPack.builder().label(label).capacity(capacity).shirtLimit(shirtLimit).price(price).build();
    }

    private static FamilyPack family(String label, int capacity, double price) {
        return FamilyPack.builder().label(label).capacity(capacity).price(price).build();
    }

    private void validate() {
        for (ItemType type : ItemType.values()) {
            Double price = unitPrices.get(type);
            if (price == null || price <= 0) {
                throw new IllegalArgumentException("Missing or non-positive unit price for " + type.getKey());
            }
        }

        Set<String> labels = new HashSet<>();
        for (MixedPack p : mixedPacks) {
            checkPack("mixed", labels, p.getLabel(), p.getCapacity(), p.getPrice());
            if (p.getShirtLimit() < 0 || p.getShirtLimit() > p.getCapacity()) {
                throw new IllegalArgumentException("Shirt limit of mixed pack " + p.getLabel()
                        + " must be between 0 and its capacity");
            }
        }
        labels.clear();
        for (FamilyPack p : shirtPacks) {
            checkPack("shirt", labels, p.getLabel(), p.getCapacity(), p.getPrice());
        }
        labels.clear();
        for (FamilyPack p : sheetPacks) {
            checkPack("sheet", labels, p.getLabel(), p.getCapacity(), p.getPrice());
        }
    }

    private static void checkPack(String family, Set<String> seen, String label, int capacity, double price) {
        try {
            Integer.parseInt(label);
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Label of " + family + " pack must be numeric: " + label, e);
        }
        if (!seen.add(label)) {
            throw new IllegalArgumentException("Duplicate " + family + " pack label: " + label);
        }
        if (capacity <= 0 || price <= 0) {
            throw new IllegalArgumentException("Capacity and price of " + family + " pack " + label
                    + " must be positive");
        }
    }
}
