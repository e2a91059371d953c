package com.laundry.pricing.domain;

import java.util.List;

/**
 * Raised when a request cannot be priced as given (unknown item types,
 * negative quantities, unknown solver backend). The caller is expected to fix the request.
 */
public class OrderValidationException extends RuntimeException {

    private final List<String> invalidKeys;

    public OrderValidationException(String message, List<String> invalidKeys) {
        super(message);
        this.invalidKeys = List.copyOf(invalidKeys);
    }

    public List<String> getInvalidKeys() {
        return invalidKeys;
    }
}
