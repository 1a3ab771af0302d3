package com.flagship.settlement_engine.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigInteger;

@Value
public class ApproveRequest {

    @NotNull(message = "Spender is required")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "must be a 0x-prefixed 20-byte hex address")
    @JsonProperty("spender")
    String spender;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;
}
