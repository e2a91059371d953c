package com.laundry.pricing;

import com.laundry.pricing.domain.DeliveryFeeTable;
import com.laundry.pricing.domain.QuoteResult;
import com.laundry.pricing.domain.SolverBackend;
import com.laundry.pricing.domain.SolverSettings;
import com.laundry.pricing.service.LaundryQuoteService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class LaundryPricingApplicationTests {

    @Autowired
    private LaundryQuoteService quoteService;

    @Autowired
    private DeliveryFeeTable deliveryFees;

    @Autowired
    private SolverSettings solverSettings;

    @Test
    void bindsConfiguredFeesAndSolver() {
        assertEquals(5.0, deliveryFees.feeFor("Montijo"));
        assertEquals(0.0, deliveryFees.feeFor("porto"));
        assertEquals(5.0, deliveryFees.feeFor("mars"));
        assertEquals(SolverBackend.SCIP, solverSettings.getBackend());
        assertTrue(solverSettings.isPreferFewerPacks());
    }

    @Test
    void quotesThroughWiredService() {
        QuoteResult result = quoteService.optimize(Map.of("camisa", 12), "lisboa");

        assertEquals(9.0, result.getTotalCost());
    }
}
