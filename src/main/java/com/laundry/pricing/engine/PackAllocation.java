package com.laundry.pricing.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Optimal purchase plan for the pack-eligible part of an order.
 * Pack maps hold every catalog label in catalog order, zero counts included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackAllocation {
    private Map<String, Integer> mixedPacks;
    private Map<String, Integer> shirtPacks;
    private Map<String, Integer> sheetPacks;
    private Map<String, Integer> shirtsInMixedPacks;

    private int looseGeneric;
    private int looseShirts;
    private int looseSheets;

    private double objectiveValue;
    private String status;
    private Map<String, Integer> decisionVariables;
    private long computationTimeMs;
}
