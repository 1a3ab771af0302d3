package com.flagship.settlement_engine.marketplace.event;

import com.flagship.settlement_engine.event.LedgerEvent;
import com.flagship.settlement_engine.marketplace.Participant;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ParticipantRegisteredEvent implements LedgerEvent {
    UUID eventId;
    String identity;
    String displayName;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ParticipantRegistered";

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

    public static ParticipantRegisteredEvent from(Participant participant) {
        return new ParticipantRegisteredEvent(
            UUID.randomUUID(),
            participant.getIdentity(),
            participant.getDisplayName(),
            participant.getRegisteredAt()
        );
    }
}
