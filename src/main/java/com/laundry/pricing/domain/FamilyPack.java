package com.laundry.pricing.domain;

import lombok.Builder;
import lombok.Value;

// Single-family pack (shirts only or sheets only).
@Value
@Builder
public class FamilyPack {
    String label;
    int capacity;
    double price;
}
