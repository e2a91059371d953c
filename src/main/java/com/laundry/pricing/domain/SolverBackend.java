package com.laundry.pricing.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

// MIP backends bundled with OR-Tools that can certify an optimum.
public enum SolverBackend {
    SCIP("SCIP"),
    CBC("CBC");

    private final String solverId;

    SolverBackend(String solverId) {
        this.solverId = solverId;
    }

    public String getSolverId() {
        return solverId;
    }

    public static Optional<SolverBackend> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(b -> b.name().equals(wanted))
                .findFirst();
    }
}
