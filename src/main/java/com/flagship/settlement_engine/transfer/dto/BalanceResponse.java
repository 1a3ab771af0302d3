package com.flagship.settlement_engine.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BalanceResponse {

    @JsonProperty("asset")
    String asset;

    @JsonProperty("holder")
    String holder;

    @JsonProperty("amount")
    BigInteger amount;
}
