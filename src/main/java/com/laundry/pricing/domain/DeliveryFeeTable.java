package com.laundry.pricing.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Flat delivery fee per location. Lookups are case-insensitive and fall back to
 * the {@value #DEFAULT_LOCATION} entry for unknown locations.
 */
public final class DeliveryFeeTable {

    public static final String DEFAULT_LOCATION = "default";

    private final Map<String, Double> fees;

    private DeliveryFeeTable(Map<String, Double> fees) {
        this.fees = fees;
    }

    public static DeliveryFeeTable of(Map<String, Double> fees) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        fees.forEach((location, fee) -> {
            if (fee == null || fee < 0) {
                throw new IllegalArgumentException("Delivery fee for " + location + " must be non-negative");
            }
            normalized.put(normalize(location), fee);
        });
        if (!normalized.containsKey(DEFAULT_LOCATION)) {
            throw new IllegalArgumentException("Delivery fee table needs a '" + DEFAULT_LOCATION + "' entry");
        }
        return new DeliveryFeeTable(Collections.unmodifiableMap(normalized));
    }

    public double feeFor(String location) {
        return fees.get(resolveLocation(location));
    }

    /**
     * Table key the location is charged under: its normalized name, or {@value #DEFAULT_LOCATION}.
     */
    public String resolveLocation(String location) {
        if (location == null) {
            return DEFAULT_LOCATION;
        }
        String key = normalize(location);
        return fees.containsKey(key) ? key : DEFAULT_LOCATION;
    }

    public Map<String, Double> asMap() {
        return fees;
    }

    private static String normalize(String location) {
        return location.trim().toLowerCase(Locale.ROOT);
    }
}
