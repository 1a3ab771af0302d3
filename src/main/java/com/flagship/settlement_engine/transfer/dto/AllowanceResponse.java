package com.flagship.settlement_engine.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class AllowanceResponse {

    @JsonProperty("asset")
    String asset;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("spender")
    String spender;

    @JsonProperty("amount")
    BigInteger amount;
}
