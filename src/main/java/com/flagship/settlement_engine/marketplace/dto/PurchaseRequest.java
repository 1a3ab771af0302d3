package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigInteger;

@Value
public class PurchaseRequest {

    @NotNull(message = "Payment amount is required")
    @JsonProperty("payment_amount")
    BigInteger paymentAmount;
}
