package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigInteger;

/**
 * Price is not range-checked here: a non-positive or wider than 256-bit
 * price is rejected by the marketplace as INVALID_PRICE.
 */
@Value
public class CreateListingRequest {

    @NotNull(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Price is required")
    @JsonProperty("price")
    BigInteger price;
}
