package com.laundry.pricing.engine;

import com.laundry.pricing.domain.FamilyPack;
import com.laundry.pricing.domain.ItemType;
import com.laundry.pricing.domain.LaundryOrder;
import com.laundry.pricing.domain.MixedPack;
import com.laundry.pricing.domain.OrderValidationException;
import com.laundry.pricing.domain.PricingCatalog;
import com.laundry.pricing.domain.SolverBackend;
import com.laundry.pricing.domain.SolverSettings;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrToolsLaundryOptimizerTest {

    private final PricingCatalog catalog = PricingCatalog.standard();
    private final OrToolsLaundryOptimizer optimizer = new OrToolsLaundryOptimizer();
    private final ExhaustiveSearch exhaustiveSearch = new ExhaustiveSearch(catalog);

    @Test
    void matchesExhaustiveSearchOnSmallOrders() {
        for (int generic = 0; generic <= 10; generic++) {
            for (int shirts = 0; shirts <= 10; shirts++) {
                LaundryOrder order = order(generic, shirts, 0);
                PackAllocation allocation = optimizer.optimize(order, catalog, SolverSettings.defaults());

                long expected = exhaustiveSearch.minimumCents(generic, shirts, 0);
                assertEquals(expected, ExhaustiveSearch.cents(allocation.getObjectiveValue()),
                        "Cost for " + generic + " garments and " + shirts + " shirts");
                assertEquals(expected, allocationCents(allocation),
                        "Allocation cost for " + generic + " garments and " + shirts + " shirts");
                assertFeasible(order, allocation);
            }
        }
    }

    @Test
    void matchesExhaustiveSearchOnSheets() {
        for (int sheets = 0; sheets <= 30; sheets++) {
            LaundryOrder order = order(0, 0, sheets);
            PackAllocation allocation = optimizer.optimize(order, catalog, SolverSettings.defaults());

            assertEquals(exhaustiveSearch.minimumCents(0, 0, sheets), allocationCents(allocation),
                    "Cost for " + sheets + " sheets");
            assertFeasible(order, allocation);
        }
    }

    @Test
    void placesShirtsInsideMixedPackWhenCheaper() {
        PackAllocation allocation = optimizer.optimize(order(18, 2, 0), catalog, SolverSettings.defaults());

        assertEquals(1, allocation.getMixedPacks().get("20"));
        assertEquals(2, allocation.getShirtsInMixedPacks().get("20"));
        assertEquals(0, allocation.getLooseGeneric());
        assertEquals(0, allocation.getLooseShirts());
        assertEquals(10.0, allocation.getObjectiveValue(), 1e-6);
    }

    @Test
    void paysShirtsIndividuallyWhenMixedPackIsFull() {
        PackAllocation allocation = optimizer.optimize(order(20, 2, 0), catalog, SolverSettings.defaults());

        assertEquals(1, allocation.getMixedPacks().get("20"));
        assertEquals(0, allocation.getShirtsInMixedPacks().get("20"));
        assertEquals(2, allocation.getLooseShirts());
        assertEquals(11.5, allocation.getObjectiveValue(), 1e-6);
    }

    @Test
    void tieBreakPrefersFewerPacks() {
        // 12 loose shirts and one 10-shirt pack plus 2 loose shirts both cost 9.00
        PackAllocation shirts = optimizer.optimize(order(0, 12, 0), catalog, SolverSettings.defaults());
        assertEquals(12, shirts.getLooseShirts());
        assertTrue(shirts.getShirtPacks().values().stream().allMatch(n -> n == 0));
        assertEquals(9.0, shirts.getObjectiveValue(), 1e-6);

        // one 40 pack or two 20 packs: both 20.00
        PackAllocation garments = optimizer.optimize(order(40, 0, 0), catalog, SolverSettings.defaults());
        assertEquals(1, garments.getMixedPacks().get("40"));
        assertEquals(0, garments.getMixedPacks().get("20"));
        assertEquals(0, garments.getShirtsInMixedPacks().values().stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void withoutTieBreakCostIsStillMinimal() {
        SolverSettings settings = SolverSettings.defaults().toBuilder().preferFewerPacks(false).build();

        PackAllocation allocation = optimizer.optimize(order(0, 12, 0), catalog, settings);

        assertEquals(900, allocationCents(allocation));
        assertFeasible(order(0, 12, 0), allocation);
    }

    @Test
    void cbcBackendFindsSameCost() {
        SolverSettings cbc = SolverSettings.defaults().toBuilder().backend(SolverBackend.CBC).build();
        int[][] orders = {{30, 5, 0}, {45, 10, 25}, {100, 6, 12}, {0, 30, 0}};

        for (int[] o : orders) {
            LaundryOrder order = order(o[0], o[1], o[2]);
            PackAllocation scip = optimizer.optimize(order, catalog, SolverSettings.defaults());
            PackAllocation other = optimizer.optimize(order, catalog, cbc);

            assertEquals(allocationCents(scip), allocationCents(other), "Cost for " + order.toItems());
            assertFeasible(order, other);
        }
    }

    @Test
    void largeOrderStaysFeasible() {
        LaundryOrder order = order(1234, 77, 95);

        PackAllocation allocation = optimizer.optimize(order, catalog, SolverSettings.defaults());

        assertEquals("OPTIMAL", allocation.getStatus());
        assertFeasible(order, allocation);
        assertEquals(allocationCents(allocation), ExhaustiveSearch.cents(allocation.getObjectiveValue()));
    }

    @Test
    void largestAcceptedOrderIsFullyCovered() {
        int max = LaundryOrder.MAX_QUANTITY;
        LaundryOrder order = order(max, max, max);

        PackAllocation allocation = optimizer.optimize(order, catalog, SolverSettings.defaults());

        assertEquals("OPTIMAL", allocation.getStatus());
        assertFeasible(order, allocation);
    }

    @Test
    void ordersTooLargeToSolveExactlyNeverReachTheSolver() {
        assertThrows(OrderValidationException.class, () -> order(1_000_000_000, 7, 0));
    }

    @Test
    void rejectsPlanLeavingGarmentsUncovered() {
        // 1000 garments + 7 shirts in five 200 packs leaves 7 garments without a place
        PackAllocation shortPlan = emptyPlan();
        shortPlan.getMixedPacks().put("200", 5);
        shortPlan.getShirtsInMixedPacks().put("200", 7);

        SolverException e = assertThrows(SolverException.class,
                () -> OrToolsLaundryOptimizer.verifyCoverage(order(1000, 7, 0), catalog, shortPlan));
        assertTrue(e.getMessage().contains("garments"), e.getMessage());
    }

    @Test
    void rejectsPlanLeavingSheetsOrShirtsUncovered() {
        PackAllocation sheetsShort = emptyPlan();
        sheetsShort.getSheetPacks().put("20", 1);
        sheetsShort.setLooseSheets(2);
        assertThrows(SolverException.class,
                () -> OrToolsLaundryOptimizer.verifyCoverage(order(0, 0, 23), catalog, sheetsShort));

        PackAllocation shirtsShort = emptyPlan();
        shirtsShort.getShirtPacks().put("10", 1);
        assertThrows(SolverException.class,
                () -> OrToolsLaundryOptimizer.verifyCoverage(order(0, 11, 0), catalog, shirtsShort));
    }

    @Test
    void rejectsPlanOverfillingShirtLimit() {
        PackAllocation overfilled = emptyPlan();
        overfilled.getMixedPacks().put("20", 1);
        overfilled.getShirtsInMixedPacks().put("20", 3);

        assertThrows(SolverException.class,
                () -> OrToolsLaundryOptimizer.verifyCoverage(order(0, 3, 0), catalog, overfilled));
    }

    @Test
    void acceptsExactlyCoveringPlan() {
        PackAllocation plan = emptyPlan();
        plan.getMixedPacks().put("20", 1);
        plan.getShirtsInMixedPacks().put("20", 2);

        OrToolsLaundryOptimizer.verifyCoverage(order(18, 2, 0), catalog, plan);
    }

    @Test
    void ignoresSpecialItems() {
        Map<ItemType, Integer> quantities = Map.of(ItemType.COAT, 3, ItemType.TOWEL, 4, ItemType.SUIT, 1);

        PackAllocation allocation = optimizer.optimize(LaundryOrder.of(quantities), catalog, SolverSettings.defaults());

        assertEquals(0.0, allocation.getObjectiveValue(), 1e-9);
        assertEquals(0, allocationCents(allocation));
    }

    @Test
    void reportsEveryDecisionVariable() {
        PackAllocation allocation = optimizer.optimize(order(18, 2, 0), catalog, SolverSettings.defaults());
        Map<String, Integer> variables = allocation.getDecisionVariables();

        int expected = 2 * catalog.getMixedPacks().size() + catalog.getShirtPacks().size()
                + catalog.getSheetPacks().size() + 3;
        assertEquals(expected, variables.size());
        assertEquals(1, variables.get("mixed_20"));
        assertEquals(2, variables.get("shirts_in_mixed_20"));
        assertEquals(0, variables.get("loose_camisa"));
    }

    private PackAllocation emptyPlan() {
        Map<String, Integer> mixed = new LinkedHashMap<>();
        Map<String, Integer> shirtsInMixed = new LinkedHashMap<>();
        for (MixedPack p : catalog.getMixedPacks()) {
            mixed.put(p.getLabel(), 0);
            shirtsInMixed.put(p.getLabel(), 0);
        }
        Map<String, Integer> shirtPacks = new LinkedHashMap<>();
        catalog.getShirtPacks().forEach(p -> shirtPacks.put(p.getLabel(), 0));
        Map<String, Integer> sheetPacks = new LinkedHashMap<>();
        catalog.getSheetPacks().forEach(p -> sheetPacks.put(p.getLabel(), 0));
        return PackAllocation.builder()
                .mixedPacks(mixed)
                .shirtsInMixedPacks(shirtsInMixed)
                .shirtPacks(shirtPacks)
                .sheetPacks(sheetPacks)
                .build();
    }

    private static LaundryOrder order(int generic, int shirts, int sheets) {
        return LaundryOrder.of(Map.of(ItemType.GENERIC, generic, ItemType.SHIRT, shirts, ItemType.SHEET, sheets));
    }

    private long allocationCents(PackAllocation allocation) {
        long total = 0;
        for (MixedPack p : catalog.getMixedPacks()) {
            total += allocation.getMixedPacks().get(p.getLabel()) * ExhaustiveSearch.cents(p.getPrice());
        }
        for (FamilyPack p : catalog.getShirtPacks()) {
            total += allocation.getShirtPacks().get(p.getLabel()) * ExhaustiveSearch.cents(p.getPrice());
        }
        for (FamilyPack p : catalog.getSheetPacks()) {
            total += allocation.getSheetPacks().get(p.getLabel()) * ExhaustiveSearch.cents(p.getPrice());
        }
        total += allocation.getLooseGeneric() * ExhaustiveSearch.cents(catalog.unitPrice(ItemType.GENERIC));
        total += allocation.getLooseShirts() * ExhaustiveSearch.cents(catalog.unitPrice(ItemType.SHIRT));
        total += allocation.getLooseSheets() * ExhaustiveSearch.cents(catalog.unitPrice(ItemType.SHEET));
        return total;
    }

    private void assertFeasible(LaundryOrder order, PackAllocation allocation) {
        long mixedCapacity = 0;
        long shirtsInMixed = 0;
        for (MixedPack p : catalog.getMixedPacks()) {
            int bought = allocation.getMixedPacks().get(p.getLabel());
            int placed = allocation.getShirtsInMixedPacks().get(p.getLabel());
            assertTrue(placed >= 0 && bought >= 0);
            assertTrue(placed <= (long) p.getShirtLimit() * bought,
                    "Shirt limit exceeded in mixed pack " + p.getLabel());
            mixedCapacity += (long) p.getCapacity() * bought;
            shirtsInMixed += placed;
        }
        long shirtPackCapacity = 0;
        for (FamilyPack p : catalog.getShirtPacks()) {
            shirtPackCapacity += (long) p.getCapacity() * allocation.getShirtPacks().get(p.getLabel());
        }
        long sheetPackCapacity = 0;
        for (FamilyPack p : catalog.getSheetPacks()) {
            sheetPackCapacity += (long) p.getCapacity() * allocation.getSheetPacks().get(p.getLabel());
        }

        assertTrue(shirtsInMixed + shirtPackCapacity + allocation.getLooseShirts() >= order.quantity(ItemType.SHIRT),
                "Shirts not covered for " + order.toItems());
        assertTrue(mixedCapacity - shirtsInMixed + allocation.getLooseGeneric() >= order.quantity(ItemType.GENERIC),
                "Garments not covered for " + order.toItems());
        assertTrue(sheetPackCapacity + allocation.getLooseSheets() >= order.quantity(ItemType.SHEET),
                "Sheets not covered for " + order.toItems());
    }
}
