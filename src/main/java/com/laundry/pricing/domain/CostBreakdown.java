package com.laundry.pricing.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// Spend per category, rounded to cents.
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostBreakdown {
    private double specialItems;
    private double mixedPacks;
    private double shirtPacks;
    private double sheetPacks;
    private double looseItems;
    private double delivery;
}
