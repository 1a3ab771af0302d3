package com.flagship.settlement_engine.transfer;

import com.flagship.settlement_engine.common.Addresses;
import lombok.Value;

/**
 * The identity that holds marketplace sale proceeds, and the asset they are paid in.
 *
 * Proceeds are pooled: one balance under {@code address} backs every
 * participant's pending amount.
 */
@Value
public class EscrowAccount {
    String address;
    String nativeAsset;

    public EscrowAccount(String address, String nativeAsset) {
        this.address = Addresses.normalize(address);
        this.nativeAsset = Addresses.normalize(nativeAsset);
    }
}
