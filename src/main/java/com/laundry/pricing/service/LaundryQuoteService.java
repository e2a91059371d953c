package com.laundry.pricing.service;

import com.laundry.pricing.domain.CostBreakdown;
import com.laundry.pricing.domain.DeliveryFeeTable;
import com.laundry.pricing.domain.FamilyPack;
import com.laundry.pricing.domain.ItemType;
import com.laundry.pricing.domain.LaundryOrder;
import com.laundry.pricing.domain.MixedPack;
import com.laundry.pricing.domain.OrderValidationException;
import com.laundry.pricing.domain.PricingCatalog;
import com.laundry.pricing.domain.QuoteResult;
import com.laundry.pricing.domain.SolverBackend;
import com.laundry.pricing.domain.SolverSettings;
import com.laundry.pricing.engine.LaundryOptimizer;
import com.laundry.pricing.engine.PackAllocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

@Slf4j
@Service
@RequiredArgsConstructor
public class LaundryQuoteService {

    private final LaundryOptimizer optimizer;
    private final PricingCatalog catalog;
    private final DeliveryFeeTable deliveryFees;
    private final SolverSettings solverSettings;

    public QuoteResult optimize(Map<String, Integer> items, String deliveryLocation) {
        return optimize(items, deliveryLocation, null);
    }

    /**
     * Prices an order at its minimum cost.
     *
     * @param items            wire item key -> quantity; missing keys count as zero
     * @param deliveryLocation matched case-insensitively, unknown locations pay the default fee
     * @param solver           optional backend name overriding the configured one
     */
    public QuoteResult optimize(Map<String, Integer> items, String deliveryLocation, String solver) {
        LaundryOrder order = LaundryOrder.fromItems(items);
        SolverSettings settings = resolveSettings(solver);

        double fee = deliveryFees.feeFor(deliveryLocation);
        log.info("Order {} | delivery={} ({} €)", order.toItems(), deliveryFees.resolveLocation(deliveryLocation), fee);

        BigDecimal specialsCost = BigDecimal.ZERO;
        for (ItemType type : ItemType.values()) {
            if (type.isSpecial()) {
                specialsCost = specialsCost.add(money(catalog.unitPrice(type), order.quantity(type)));
            }
        }

        PackAllocation allocation = optimizer.optimize(order, catalog, settings);

        BigDecimal mixedCost = packCost(catalog.getMixedPacks(), allocation.getMixedPacks(),
                MixedPack::getLabel, MixedPack::getPrice);
        BigDecimal shirtCost = packCost(catalog.getShirtPacks(), allocation.getShirtPacks(),
                FamilyPack::getLabel, FamilyPack::getPrice);
        BigDecimal sheetCost = packCost(catalog.getSheetPacks(), allocation.getSheetPacks(),
                FamilyPack::getLabel, FamilyPack::getPrice);
        BigDecimal looseCost = money(catalog.unitPrice(ItemType.GENERIC), allocation.getLooseGeneric())
                .add(money(catalog.unitPrice(ItemType.SHIRT), allocation.getLooseShirts()))
                .add(money(catalog.unitPrice(ItemType.SHEET), allocation.getLooseSheets()));
        BigDecimal delivery = BigDecimal.valueOf(fee);

        BigDecimal total = specialsCost.add(mixedCost).add(shirtCost).add(sheetCost).add(looseCost).add(delivery);

        Map<String, Integer> loose = new LinkedHashMap<>();
        loose.put(ItemType.GENERIC.getKey(), allocation.getLooseGeneric());
        loose.put(ItemType.SHIRT.getKey(), allocation.getLooseShirts());
        loose.put(ItemType.SHEET.getKey(), allocation.getLooseSheets());

        CostBreakdown costs = CostBreakdown.builder()
                .specialItems(round(specialsCost))
                .mixedPacks(round(mixedCost))
                .shirtPacks(round(shirtCost))
                .sheetPacks(round(sheetCost))
                .looseItems(round(looseCost))
                .delivery(round(delivery))
                .build();

        return QuoteResult.builder()
                .totalCost(round(total))
                .mixedPacks(nonZeroByLabel(allocation.getMixedPacks()))
                .shirtPacks(nonZeroByLabel(allocation.getShirtPacks()))
                .sheetPacks(nonZeroByLabel(allocation.getSheetPacks()))
                .looseItems(loose)
                .shirtsInMixedPacks(nonZeroByLabel(allocation.getShirtsInMixedPacks()))
                .costs(costs)
                .solverBackend(settings.getBackend().name())
                .status(allocation.getStatus())
                .decisionVariables(allocation.getDecisionVariables())
                .computationTimeMs(allocation.getComputationTimeMs())
                .build();
    }

    private SolverSettings resolveSettings(String solver) {
        if (solver == null || solver.isBlank()) {
            return solverSettings;
        }
        SolverBackend backend = SolverBackend.fromName(solver)
                .orElseThrow(() -> new OrderValidationException("Unknown solver backend: " + solver, List.of()));
        return solverSettings.toBuilder().backend(backend).build();
    }

    private static <P> BigDecimal packCost(List<P> packs, Map<String, Integer> counts,
                                           Function<P, String> label,
                                           ToDoubleFunction<P> price) {
        BigDecimal cost = BigDecimal.ZERO;
        for (P pack : packs) {
            cost = cost.add(money(price.applyAsDouble(pack), counts.getOrDefault(label.apply(pack), 0)));
        }
        return cost;
    }

    private static Map<String, Integer> nonZeroByLabel(Map<String, Integer> counts) {
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .filter(e -> e.getValue() != 0)
                .sorted(Comparator.comparingInt(e -> Integer.parseInt(e.getKey())))
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    private static BigDecimal money(double price, int quantity) {
        return BigDecimal.valueOf(price).multiply(BigDecimal.valueOf(quantity));
    }

    private static double round(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
