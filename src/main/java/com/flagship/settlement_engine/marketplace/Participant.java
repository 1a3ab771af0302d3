package com.flagship.settlement_engine.marketplace;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A registered marketplace identity with its escrowed, not yet withdrawn proceeds.
 */
@Value
public class Participant {
    String identity;
    String displayName;
    BigInteger pendingBalance;
    Instant registeredAt;
}
