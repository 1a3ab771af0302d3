package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.marketplace.Participant;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

@Value
@Builder
public class ParticipantResponse {

    @JsonProperty("identity")
    String identity;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("pending_balance")
    BigInteger pendingBalance;

    @JsonProperty("registered_at")
    Instant registeredAt;

    public static ParticipantResponse from(Participant participant) {
        return ParticipantResponse.builder()
            .identity(participant.getIdentity())
            .displayName(participant.getDisplayName())
            .pendingBalance(participant.getPendingBalance())
            .registeredAt(participant.getRegisteredAt())
            .build();
    }
}
