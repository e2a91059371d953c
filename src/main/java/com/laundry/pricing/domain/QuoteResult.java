package com.laundry.pricing.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteResult {
    private double totalCost;

    // Pack label -> count, non-zero only, ascending by capacity label
    private Map<String, Integer> mixedPacks;
    private Map<String, Integer> shirtPacks;
    private Map<String, Integer> sheetPacks;

    // Item key -> count paid individually (peca_variada, camisa, lencol)
    private Map<String, Integer> looseItems;

    // Mixed pack label -> shirts placed in those packs, non-zero only
    private Map<String, Integer> shirtsInMixedPacks;

    private CostBreakdown costs;

    // Solver details
    private String solverBackend;
    private String status;
    private Map<String, Integer> decisionVariables;
    private long computationTimeMs;
}
