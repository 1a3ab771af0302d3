package com.flagship.settlement_engine.swap.event;

import com.flagship.settlement_engine.authorization.SwapOrder;
import com.flagship.settlement_engine.event.LedgerEvent;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when an initiator cancels an order before it was executed.
 */
@Value
public class SwapCancelledEvent implements LedgerEvent {
    UUID eventId;
    String fingerprint;
    BigInteger orderId;
    String initiator;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SwapCancelled";

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

    public static SwapCancelledEvent of(String fingerprint, SwapOrder order, Instant occurredAt) {
        return new SwapCancelledEvent(UUID.randomUUID(), fingerprint, order.getId(), order.getInitiator(), occurredAt);
    }
}
