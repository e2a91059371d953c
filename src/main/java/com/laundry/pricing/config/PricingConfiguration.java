package com.laundry.pricing.config;

import com.laundry.pricing.domain.DeliveryFeeTable;
import com.laundry.pricing.domain.PricingCatalog;
import com.laundry.pricing.domain.SolverBackend;
import com.laundry.pricing.domain.SolverSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

// Immutable pricing data shared by all requests.
@Slf4j
@Configuration
public class PricingConfiguration {

    @Bean
    public PricingCatalog pricingCatalog() {
        PricingCatalog catalog = PricingCatalog.standard();
        log.info("Pricing catalog loaded: {} mixed, {} shirt and {} sheet packs",
                catalog.getMixedPacks().size(), catalog.getShirtPacks().size(), catalog.getSheetPacks().size());
        return catalog;
    }

    @Bean
    public DeliveryFeeTable deliveryFeeTable(LaundryProperties properties) {
        DeliveryFeeTable table = DeliveryFeeTable.of(properties.getDeliveryFees());
        log.info("Delivery fees: {}", table.asMap());
        return table;
    }

    @Bean
    public SolverSettings solverSettings(LaundryProperties properties) {
        LaundryProperties.Solver solver = properties.getSolver();
        SolverBackend backend = SolverBackend.fromName(solver.getBackend())
                .orElseThrow(() -> new IllegalStateException("Unsupported solver backend: " + solver.getBackend()));
        return SolverSettings.builder()
                .backend(backend)
                .timeLimitMs(solver.getTimeLimitMs())
                .preferFewerPacks(solver.isPreferFewerPacks())
                .build();
    }
}
