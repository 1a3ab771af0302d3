package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class WithdrawalResponse {

    @JsonProperty("identity")
    String identity;

    @JsonProperty("asset")
    String asset;

    @JsonProperty("amount")
    BigInteger amount;
}
