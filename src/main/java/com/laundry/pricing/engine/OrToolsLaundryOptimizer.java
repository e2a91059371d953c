package com.laundry.pricing.engine;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import com.laundry.pricing.domain.FamilyPack;
import com.laundry.pricing.domain.ItemType;
import com.laundry.pricing.domain.LaundryOrder;
import com.laundry.pricing.domain.MixedPack;
import com.laundry.pricing.domain.PricingCatalog;
import com.laundry.pricing.domain.SolverSettings;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Integer program over pack purchases, solved with an OR-Tools MIP backend.
 *
 * <pre>
 *   min  sum(price * packs) + sum(unit price * loose items)
 *   s.t. s[p] <= shirtLimit[p] * x[p]                      for each mixed pack p
 *        sum(s) + sum(cap[q] * y[q]) + looseShirts >= shirts
 *        sum(cap[p] * x[p] - s[p]) + looseGeneric   >= generic
 *        sum(cap[r] * z[r]) + looseSheets           >= sheets
 * </pre>
 */
@Slf4j
@Component
public class OrToolsLaundryOptimizer implements LaundryOptimizer {

    static {
        Loader.loadNativeLibraries();
    }

    // Catalog prices are whole cents, so two distinct costs differ by far more than this.
    private static final double COST_TOLERANCE = 1e-4;

    @Override
    public PackAllocation optimize(LaundryOrder order, PricingCatalog catalog, SolverSettings settings) {
        long startTime = System.currentTimeMillis();

        // 1. Initialize Solver
        MPSolver solver = MPSolver.createSolver(settings.getBackend().getSolverId());
        if (solver == null) {
            log.error("Could not create solver {}", settings.getBackend());
            throw new SolverException("Could not create solver " + settings.getBackend());
        }

        // Solve to proven optimality; SCIP's default relative gap would accept near-optimal plans
        MPSolverParameters parameters = new MPSolverParameters();
        parameters.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, 0.0);

        try {
            PackAllocation allocation = solve(solver, parameters, order, catalog, settings);
            verifyCoverage(order, catalog, allocation);
            allocation.setComputationTimeMs(System.currentTimeMillis() - startTime);
            return allocation;
        } finally {
            parameters.delete();
            solver.delete();
        }
    }

    private PackAllocation solve(MPSolver solver, MPSolverParameters parameters, LaundryOrder order,
                                 PricingCatalog catalog, SolverSettings settings) {
        int generic = order.quantity(ItemType.GENERIC);
        int shirts = order.quantity(ItemType.SHIRT);
        int sheets = order.quantity(ItemType.SHEET);
        double infinity = MPSolver.infinity();

        List<MixedPack> mixedPacks = catalog.getMixedPacks();
        List<FamilyPack> shirtPacks = catalog.getShirtPacks();
        List<FamilyPack> sheetPacks = catalog.getSheetPacks();

        // 2. Define Variables
        // x[i]: mixed packs bought, s[i]: shirts placed in them
        MPVariable[] x = new MPVariable[mixedPacks.size()];
        MPVariable[] s = new MPVariable[mixedPacks.size()];
        for (int i = 0; i < x.length; i++) {
            String label = mixedPacks.get(i).getLabel();
            x[i] = solver.makeIntVar(0.0, infinity, "mixed_" + label);
            s[i] = solver.makeIntVar(0.0, infinity, "shirts_in_mixed_" + label);
        }
        // y[j]: shirt packs, z[k]: sheet packs
        MPVariable[] y = new MPVariable[shirtPacks.size()];
        for (int j = 0; j < y.length; j++) {
            y[j] = solver.makeIntVar(0.0, infinity, "shirt_pack_" + shirtPacks.get(j).getLabel());
        }
        MPVariable[] z = new MPVariable[sheetPacks.size()];
        for (int k = 0; k < z.length; k++) {
            z[k] = solver.makeIntVar(0.0, infinity, "sheet_pack_" + sheetPacks.get(k).getLabel());
        }
        MPVariable looseGeneric = solver.makeIntVar(0.0, infinity, "loose_" + ItemType.GENERIC.getKey());
        MPVariable looseShirts = solver.makeIntVar(0.0, infinity, "loose_" + ItemType.SHIRT.getKey());
        MPVariable looseSheets = solver.makeIntVar(0.0, infinity, "loose_" + ItemType.SHEET.getKey());

        // 3. Constraints

        // C1. Shirt sub-limit: s[i] - limit * x[i] <= 0
        for (int i = 0; i < x.length; i++) {
            MPConstraint limit = solver.makeConstraint(-infinity, 0.0, "shirt_limit_" + mixedPacks.get(i).getLabel());
            limit.setCoefficient(s[i], 1.0);
            limit.setCoefficient(x[i], -mixedPacks.get(i).getShirtLimit());
        }

        // C2. Shirt coverage
        MPConstraint coverShirts = solver.makeConstraint(shirts, infinity, "cover_shirts");
        for (MPVariable v : s) {
            coverShirts.setCoefficient(v, 1.0);
        }
        for (int j = 0; j < y.length; j++) {
            coverShirts.setCoefficient(y[j], shirtPacks.get(j).getCapacity());
        }
        coverShirts.setCoefficient(looseShirts, 1.0);

        // C3. Generic coverage: capacity left in mixed packs after their shirts
        MPConstraint coverGeneric = solver.makeConstraint(generic, infinity, "cover_generic");
        for (int i = 0; i < x.length; i++) {
            coverGeneric.setCoefficient(x[i], mixedPacks.get(i).getCapacity());
            coverGeneric.setCoefficient(s[i], -1.0);
        }
        coverGeneric.setCoefficient(looseGeneric, 1.0);

        // C4. Sheet coverage
        MPConstraint coverSheets = solver.makeConstraint(sheets, infinity, "cover_sheets");
        for (int k = 0; k < z.length; k++) {
            coverSheets.setCoefficient(z[k], sheetPacks.get(k).getCapacity());
        }
        coverSheets.setCoefficient(looseSheets, 1.0);

        // 4. Objective: total spend on packs and loose items
        List<CostTerm> costTerms = new ArrayList<>();
        for (int i = 0; i < x.length; i++) {
            costTerms.add(new CostTerm(x[i], mixedPacks.get(i).getPrice()));
        }
        for (int j = 0; j < y.length; j++) {
            costTerms.add(new CostTerm(y[j], shirtPacks.get(j).getPrice()));
        }
        for (int k = 0; k < z.length; k++) {
            costTerms.add(new CostTerm(z[k], sheetPacks.get(k).getPrice()));
        }
        costTerms.add(new CostTerm(looseGeneric, catalog.unitPrice(ItemType.GENERIC)));
        costTerms.add(new CostTerm(looseShirts, catalog.unitPrice(ItemType.SHIRT)));
        costTerms.add(new CostTerm(looseSheets, catalog.unitPrice(ItemType.SHEET)));

        MPObjective objective = solver.objective();
        for (CostTerm term : costTerms) {
            objective.setCoefficient(term.getVariable(), term.getPrice());
        }
        objective.setMinimization();

        if (settings.getTimeLimitMs() > 0) {
            solver.setTimeLimit(settings.getTimeLimitMs());
        }

        MPSolver.ResultStatus status = solver.solve(parameters);
        requireOptimal(status, "cost minimization", order);
        double minimumCost = objective.value();

        // 5. Tie-break at the optimal cost: fewest packs, then fewest shirts in mixed packs.
        // One pack outweighs any change in shirts placed, which never exceeds the ordered shirts.
        if (settings.isPreferFewerPacks()) {
            MPConstraint costCap = solver.makeConstraint(-infinity, minimumCost + COST_TOLERANCE, "cost_cap");
            for (CostTerm term : costTerms) {
                costCap.setCoefficient(term.getVariable(), term.getPrice());
            }

            double packWeight = shirts + 1.0;
            objective.clear();
            for (MPVariable v : x) {
                objective.setCoefficient(v, packWeight);
            }
            for (MPVariable v : y) {
                objective.setCoefficient(v, packWeight);
            }
            for (MPVariable v : z) {
                objective.setCoefficient(v, packWeight);
            }
            for (MPVariable v : s) {
                objective.setCoefficient(v, 1.0);
            }
            objective.setMinimization();

            requireOptimal(solver.solve(parameters), "tie-break", order);
        }

        // 6. Extract solution
        Map<String, Integer> mixedCounts = new LinkedHashMap<>();
        Map<String, Integer> shirtsInMixed = new LinkedHashMap<>();
        for (int i = 0; i < x.length; i++) {
            mixedCounts.put(mixedPacks.get(i).getLabel(), intValue(x[i]));
            shirtsInMixed.put(mixedPacks.get(i).getLabel(), intValue(s[i]));
        }
        Map<String, Integer> shirtCounts = new LinkedHashMap<>();
        for (int j = 0; j < y.length; j++) {
            shirtCounts.put(shirtPacks.get(j).getLabel(), intValue(y[j]));
        }
        Map<String, Integer> sheetCounts = new LinkedHashMap<>();
        for (int k = 0; k < z.length; k++) {
            sheetCounts.put(sheetPacks.get(k).getLabel(), intValue(z[k]));
        }

        Map<String, Integer> variables = new LinkedHashMap<>();
        for (MPVariable v : solver.variables()) {
            variables.put(v.name(), intValue(v));
        }

        return PackAllocation.builder()
                .mixedPacks(mixedCounts)
                .shirtPacks(shirtCounts)
                .sheetPacks(sheetCounts)
                .shirtsInMixedPacks(shirtsInMixed)
                .looseGeneric(intValue(looseGeneric))
                .looseShirts(intValue(looseShirts))
                .looseSheets(intValue(looseSheets))
                .objectiveValue(minimumCost)
                .status(status.name())
                .decisionVariables(variables)
                .build();
    }

    private void requireOptimal(MPSolver.ResultStatus status, String phase, LaundryOrder order) {
        if (status != MPSolver.ResultStatus.OPTIMAL) {
            log.error("Solver failed during {} with status {} for order {}", phase, status, order.toItems());
            throw new SolverException("Solver failed: " + status);
        }
    }

    /**
     * Rechecks the rounded integer plan against the order. Solver feasibility tolerances are
     * relative, so a plan the solver accepts can still leave items uncovered.
     */
    static void verifyCoverage(LaundryOrder order, PricingCatalog catalog, PackAllocation allocation) {
        long mixedCapacity = 0;
        long shirtsInMixed = 0;
        for (MixedPack p : catalog.getMixedPacks()) {
            long bought = allocation.getMixedPacks().get(p.getLabel());
            long placed = allocation.getShirtsInMixedPacks().get(p.getLabel());
            if (bought < 0 || placed < 0 || placed > p.getShirtLimit() * bought) {
                fail("shirt limit of mixed pack " + p.getLabel() + " violated", order);
            }
            mixedCapacity += p.getCapacity() * bought;
            shirtsInMixed += placed;
        }
        long shirtCapacity = familyCapacity(catalog.getShirtPacks(), allocation.getShirtPacks(), order);
        long sheetCapacity = familyCapacity(catalog.getSheetPacks(), allocation.getSheetPacks(), order);

        if (shirtsInMixed + shirtCapacity + allocation.getLooseShirts() < order.quantity(ItemType.SHIRT)) {
            fail("shirts not covered", order);
        }
        if (mixedCapacity - shirtsInMixed + allocation.getLooseGeneric() < order.quantity(ItemType.GENERIC)) {
            fail("garments not covered", order);
        }
        if (sheetCapacity + allocation.getLooseSheets() < order.quantity(ItemType.SHEET)) {
            fail("sheets not covered", order);
        }
    }

    private static long familyCapacity(List<FamilyPack> packs, Map<String, Integer> counts, LaundryOrder order) {
        long capacity = 0;
        for (FamilyPack p : packs) {
            long bought = counts.get(p.getLabel());
            if (bought < 0) {
                fail("negative count for pack " + p.getLabel(), order);
            }
            capacity += p.getCapacity() * bought;
        }
        return capacity;
    }

    private static void fail(String reason, LaundryOrder order) {
        log.error("Solver returned an invalid plan: {} for order {}", reason, order.toItems());
        throw new SolverException("Solver returned an invalid plan: " + reason);
    }

    private static int intValue(MPVariable v) {
        return (int) Math.round(v.solutionValue());
    }

    @Value
    private static class CostTerm {
        MPVariable variable;
        double price;
    }
}
