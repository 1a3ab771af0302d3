package com.flagship.settlement_engine.marketplace.event;

import com.flagship.settlement_engine.event.LedgerEvent;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a participant pulls their pending proceeds out of escrow.
 */
@Value
public class FundsWithdrawnEvent implements LedgerEvent {
    UUID eventId;
    String identity;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FundsWithdrawn";

    @Override
    public String getAggregateType() {
        return "Participant";
    }

    @Override
    public String getAggregateId() {
        return identity;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FundsWithdrawnEvent of(String identity, BigInteger amount, Instant occurredAt) {
        return new FundsWithdrawnEvent(UUID.randomUUID(), identity, amount, occurredAt);
    }
}
