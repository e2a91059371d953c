package com.laundry.pricing.engine;

import com.laundry.pricing.domain.LaundryOrder;
import com.laundry.pricing.domain.PricingCatalog;
import com.laundry.pricing.domain.SolverSettings;

public interface LaundryOptimizer {

    /**
     * Finds the cheapest mix of packs and individually paid items covering the
     * generic garments, shirts and sheets of the order. Special items are ignored.
     *
     * @throws SolverException if no certified optimum is found
     */
    PackAllocation optimize(LaundryOrder order, PricingCatalog catalog, SolverSettings settings);
}
