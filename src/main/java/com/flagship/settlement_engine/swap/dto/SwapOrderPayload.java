package com.flagship.settlement_engine.swap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.authorization.SwapOrder;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigInteger;

/**
 * Swap order terms as sent by clients. Integers may be JSON numbers or decimal strings.
 */
@Value
public class SwapOrderPayload {

    private static final String ADDRESS = "^0x[0-9a-fA-F]{40}$";
    private static final String ADDRESS_MESSAGE = "must be a 0x-prefixed 20-byte hex address";

    @NotNull(message = "Order id is required")
    @JsonProperty("id")
    BigInteger id;

    @NotNull(message = "Initiator is required")
    @Pattern(regexp = ADDRESS, message = ADDRESS_MESSAGE)
    @JsonProperty("initiator")
    String initiator;

    @NotNull(message = "Counterparty is required")
    @Pattern(regexp = ADDRESS, message = ADDRESS_MESSAGE)
    @JsonProperty("counterparty")
    String counterparty;

    @NotNull(message = "Asset A is required")
    @Pattern(regexp = ADDRESS, message = ADDRESS_MESSAGE)
    @JsonProperty("asset_a")
    String assetA;

    @NotNull(message = "Asset B is required")
    @Pattern(regexp = ADDRESS, message = ADDRESS_MESSAGE)
    @JsonProperty("asset_b")
    String assetB;

    @NotNull(message = "Amount A is required")
    @JsonProperty("amount_a")
    BigInteger amountA;

    @NotNull(message = "Amount B is required")
    @JsonProperty("amount_b")
    BigInteger amountB;

    @NotNull(message = "Expiry is required")
    @JsonProperty("expiry")
    BigInteger expiry;

    /**
     * @throws IllegalArgumentException if an integer is outside the unsigned 256-bit range
     */
    public SwapOrder toOrder() {
        return new SwapOrder(id, initiator, counterparty, assetA, assetB, amountA, amountB, expiry);
    }
}
