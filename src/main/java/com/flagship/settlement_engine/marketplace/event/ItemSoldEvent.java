package com.flagship.settlement_engine.marketplace.event;

import com.flagship.settlement_engine.event.LedgerEvent;
import com.flagship.settlement_engine.marketplace.Listing;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a listing changes hands. The price is now pending for the seller.
 */
@Value
public class ItemSoldEvent implements LedgerEvent {
    UUID eventId;
    long listingId;
    String seller;
    String buyer;
    BigInteger price;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ItemSold";

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

    public static ItemSoldEvent from(Listing listing) {
        return new ItemSoldEvent(
            UUID.randomUUID(),
            listing.getId(),
            listing.getSeller(),
            listing.getOwner(),
            listing.getPrice(),
            listing.getSoldAt()
        );
    }
}
