package com.flagship.settlement_engine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact emitted by a successful ledger operation.
 *
 * Events are written to the outbox inside the operation's transaction, so
 * a rolled-back operation never emits one.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance, used for consumer deduplication.
     */
    UUID getEventId();

    /**
     * Aggregate family used for topic routing: "Swap", "Participant" or "Listing".
     */
    String getAggregateType();

    /**
     * Fingerprint, identity or listing id the event is about. Used as the Kafka key.
     */
    String getAggregateId();

    /**
     * Ledger time of the operation.
     */
    Instant getOccurredAt();

    String getEventType();
}
