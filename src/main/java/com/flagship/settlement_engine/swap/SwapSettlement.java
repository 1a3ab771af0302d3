package com.flagship.settlement_engine.swap;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Recorded outcome of one swap fingerprint.
 *
 * For UNSEEN fingerprints every field other than fingerprint and status is null.
 */
@Value
public class SwapSettlement {
    String fingerprint;
    SettlementStatus status;
    BigInteger orderId;
    String initiator;
    String counterparty;
    String settledBy;
    Instant settledAt;

    public static SwapSettlement unseen(String fingerprint) {
        return new SwapSettlement(fingerprint, SettlementStatus.UNSEEN, null, null, null, null, null);
    }
}
