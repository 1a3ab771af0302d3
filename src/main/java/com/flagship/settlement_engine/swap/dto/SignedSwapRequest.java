package com.flagship.settlement_engine.swap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * An order together with the initiator's 65-byte signature over its digest.
 */
@Value
public class SignedSwapRequest {

    @Valid
    @NotNull(message = "Order is required")
    @JsonProperty("order")
    SwapOrderPayload order;

    @NotBlank(message = "Signature is required")
    @JsonProperty("signature")
    String signature;
}
