package com.laundry.pricing.web;

import com.laundry.pricing.domain.QuoteResult;
import com.laundry.pricing.service.LaundryQuoteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class QuoteController {

    private final LaundryQuoteService quoteService;

    @PostMapping({"/optimize", "/api/v1/optimize"})
    public ResponseEntity<QuoteResponse> optimize(@Valid @RequestBody QuoteRequest request) {
        QuoteResult result = quoteService.optimize(
                request.getItems(),
                request.getDeliveryLocation(),
                request.getSolver()
        );
        log.debug("Quote {} solved by {} in {} ms", result.getTotalCost(),
                result.getSolverBackend(), result.getComputationTimeMs());
        return ResponseEntity.ok(QuoteResponse.from(result));
    }
}
