package com.flagship.settlement_engine.authorization;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.common.Uint256;
import lombok.Value;
import lombok.With;

import java.math.BigInteger;

/**
 * Terms of a bilateral swap as signed by the initiator.
 *
 * Only ever transient input: the ledger persists the order's fingerprint
 * and its outcome, never the order itself. Field order is the wire order
 * used for both the fingerprint and the signing hash.
 */
@Value
@With
public class SwapOrder {
    BigInteger id;
    String initiator;
    String counterparty;
    String assetA;
    String assetB;
    BigInteger amountA;
    BigInteger amountB;
    BigInteger expiry;

    public SwapOrder(BigInteger id, String initiator, String counterparty, String assetA, String assetB,
                     BigInteger amountA, BigInteger amountB, BigInteger expiry) {
        this.id = Uint256.require(id, "id");
        this.initiator = Addresses.normalize(initiator);
        this.counterparty = Addresses.normalize(counterparty);
        this.assetA = Addresses.normalize(assetA);
        this.assetB = Addresses.normalize(assetB);
        this.amountA = Uint256.require(amountA, "amountA");
        this.amountB = Uint256.require(amountB, "amountB");
        this.expiry = Uint256.require(expiry, "expiry");
    }

    /**
     * Whether the order can no longer be executed at the given time (epoch seconds).
     */
    public boolean isExpiredAt(long epochSeconds) {
        return BigInteger.valueOf(epochSeconds).compareTo(expiry) >= 0;
    }
}
