package com.flagship.settlement_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an outbox event.
 *
 * Written atomically with the ledger operation that produced it, then
 * published to Kafka by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Swap", "Participant" or "Listing"
    String aggregateId;        // fingerprint, identity or listing id
    String eventType;          // e.g. "SwapExecuted"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public boolean isPublished() {
        return publishedAt != null;
    }
}
