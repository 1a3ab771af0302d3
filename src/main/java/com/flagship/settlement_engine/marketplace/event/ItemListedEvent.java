package com.flagship.settlement_engine.marketplace.event;

import com.flagship.settlement_engine.event.LedgerEvent;
import com.flagship.settlement_engine.marketplace.Listing;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class ItemListedEvent implements LedgerEvent {
    UUID eventId;
    long listingId;
    String name;
    BigInteger price;
    String owner;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ItemListed";

    @Override
    public String getAggregateType() {
        return "Listing";
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(listingId);
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ItemListedEvent from(Listing listing) {
        return new ItemListedEvent(
            UUID.randomUUID(),
            listing.getId(),
            listing.getName(),
            listing.getPrice(),
            listing.getOwner(),
            listing.getListedAt()
        );
    }
}
