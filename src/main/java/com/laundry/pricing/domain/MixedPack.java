package com.laundry.pricing.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Pack holding up to {@code capacity} garments of any kind, of which at most
 * {@code shirtLimit} may be shirts.
 */
@Value
@Builder
public class MixedPack {
    String label;
    int capacity;
    int shirtLimit;
    double price;
}
