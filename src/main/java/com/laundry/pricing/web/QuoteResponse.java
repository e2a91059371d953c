package com.laundry.pricing.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.laundry.pricing.domain.CostBreakdown;
import com.laundry.pricing.domain.QuoteResult;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Quote as returned to clients; field names follow the shop's existing API.
 */
@Data
@Builder
public class QuoteResponse {

    @JsonProperty("total_cost")
    private double totalCost;

    @JsonProperty("packs_mistos")
    private Map<String, Integer> mixedPacks;

    @JsonProperty("packs_camisas")
    private Map<String, Integer> shirtPacks;

    @JsonProperty("packs_lencois")
    private Map<String, Integer> sheetPacks;

    @JsonProperty("avulso")
    private Map<String, Integer> looseItems;

    @JsonProperty("camisas_nos_mistos")
    private Map<String, Integer> shirtsInMixedPacks;

    @JsonProperty("custos")
    private Costs costs;

    @Data
    @Builder
    public static class Costs {

        @JsonProperty("pecas_especiais")
        private double specialItems;

        @JsonProperty("packs_mistos")
        private double mixedPacks;

        @JsonProperty("packs_camisas")
        private double shirtPacks;

        @JsonProperty("packs_lencois")
        private double sheetPacks;

        @JsonProperty("avulso")
        private double looseItems;

        @JsonProperty("entrega")
        private double delivery;
    }

    public static QuoteResponse from(QuoteResult result) {
        CostBreakdown c = result.getCosts();
        return QuoteResponse.builder()
                .totalCost(result.getTotalCost())
                .mixedPacks(result.getMixedPacks())
                .shirtPacks(result.getShirtPacks())
                .sheetPacks(result.getSheetPacks())
                .looseItems(result.getLooseItems())
                .shirtsInMixedPacks(result.getShirtsInMixedPacks())
                .costs(Costs.builder()
                        .specialItems(c.getSpecialItems())
                        .mixedPacks(c.getMixedPacks())
                        .shirtPacks(c.getShirtPacks())
                        .sheetPacks(c.getSheetPacks())
                        .looseItems(c.getLooseItems())
                        .delivery(c.getDelivery())
                        .build())
                .build();
    }
}
