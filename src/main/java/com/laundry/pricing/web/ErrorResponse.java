package com.laundry.pricing.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String error, @JsonProperty("invalid_keys") List<String> invalidKeys) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, List.of());
    }
}
