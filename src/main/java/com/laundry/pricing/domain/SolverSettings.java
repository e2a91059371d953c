package com.laundry.pricing.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SolverSettings {
    private SolverBackend backend;

    // Wall-clock limit per solve; 0 or less means no limit
    private long timeLimitMs;

    /**
     * When set, the model is re-solved at the optimal cost to prefer the allocation
     * with the fewest packs, then the fewest shirts placed in mixed packs.
     */
    private boolean preferFewerPacks;

    public static SolverSettings defaults() {
        return SolverSettings.builder()
                .backend(SolverBackend.SCIP)
                .timeLimitMs(10_000)
                .preferFewerPacks(true)
                .build();
    }
}
