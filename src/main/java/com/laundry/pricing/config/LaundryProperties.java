package com.laundry.pricing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for quoting, bound from {@code laundry.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "laundry")
public class LaundryProperties {

    /**
     * Flat delivery fee per location. Must contain a "default" entry.
     */
    private Map<String, Double> deliveryFees = new LinkedHashMap<>();

    private Solver solver = new Solver();

    @Data
    public static class Solver {

        /**
         * OR-Tools MIP backend: SCIP or CBC.
         */
        private String backend = "SCIP";

        /**
         * Time limit per solve in milliseconds; 0 disables it.
         */
        private long timeLimitMs = 10000;

        /**
         * Break cost ties towards fewer packs.
         */
        private boolean preferFewerPacks = true;
    }
}
