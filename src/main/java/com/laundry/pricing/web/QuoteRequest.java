package com.laundry.pricing.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuoteRequest {

    @NotNull(message = "items are required")
    private Map<String, Integer> items;

    @JsonProperty("delivery_location")
    private String deliveryLocation = "default";

    private String solver; // "SCIP" or "CBC", configured default when absent
}
