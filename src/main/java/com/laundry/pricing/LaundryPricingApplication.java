package com.laundry.pricing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LaundryPricingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LaundryPricingApplication.class, args);
    }
}
