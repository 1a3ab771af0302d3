package com.flagship.settlement_engine.swap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.swap.SettlementStatus;
import com.flagship.settlement_engine.swap.SwapSettlement;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

@Value
@Builder
public class SwapSettlementResponse {

    @JsonProperty("fingerprint")
    String fingerprint;

    @JsonProperty("status")
    SettlementStatus status;

    @JsonProperty("order_id")
    BigInteger orderId;

    @JsonProperty("initiator")
    String initiator;

    @JsonProperty("counterparty")
    String counterparty;

    @JsonProperty("settled_by")
    String settledBy;

    @JsonProperty("settled_at")
    Instant settledAt;

    public static SwapSettlementResponse from(SwapSettlement settlement) {
        return SwapSettlementResponse.builder()
            .fingerprint(settlement.getFingerprint())
            .status(settlement.getStatus())
            .orderId(settlement.getOrderId())
            .initiator(settlement.getInitiator())
            .counterparty(settlement.getCounterparty())
            .settledBy(settlement.getSettledBy())
            .settledAt(settlement.getSettledAt())
            .build();
    }
}
