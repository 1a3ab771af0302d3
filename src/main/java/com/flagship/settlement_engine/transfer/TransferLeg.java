package com.flagship.settlement_engine.transfer;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.common.Uint256;
import lombok.Value;

import java.math.BigInteger;

/**
 * One movement of an asset between two holders.
 */
@Value
public class TransferLeg {
    String asset;
    String from;
    String to;
    BigInteger amount;

    private TransferLeg(String asset, String from, String to, BigInteger amount) {
        this.asset = Addresses.normalize(asset);
        this.from = Addresses.normalize(from);
        this.to = Addresses.normalize(to);
        this.amount = Uint256.require(amount, "amount");
    }

    public static TransferLeg of(String asset, String from, String to, BigInteger amount) {
        return new TransferLeg(asset, from, to, amount);
    }
}
