package com.flagship.settlement_engine.swap.event;

import com.flagship.settlement_engine.authorization.SwapOrder;
import com.flagship.settlement_engine.event.LedgerEvent;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a counterparty executes a swap and both legs have moved.
 */
@Value
public class SwapExecutedEvent implements LedgerEvent {
    UUID eventId;
    String fingerprint;
    BigInteger orderId;
    String initiator;
    String counterparty;
    String assetA;
    String assetB;
    BigInteger amountA;
    BigInteger amountB;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SwapExecuted";

    @Override
    public String getAggregateType() {
        return "Swap";
    }

    @Override
    public String getAggregateId() {
        return fingerprint;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SwapExecutedEvent of(String fingerprint, SwapOrder order, Instant occurredAt) {
        return new SwapExecutedEvent(
            UUID.randomUUID(),
            fingerprint,
            order.getId(),
            order.getInitiator(),
            order.getCounterparty(),
            order.getAssetA(),
            order.getAssetB(),
            order.getAmountA(),
            order.getAmountB(),
            occurredAt
        );
    }
}
