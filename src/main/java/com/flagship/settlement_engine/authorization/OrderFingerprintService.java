package com.flagship.settlement_engine.authorization;

import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

/**
 * Derives the settlement key of a swap order.
 *
 * The fingerprint is keccak-256 over the tightly packed fields in wire
 * order. Every field has a fixed width, so packing without length
 * prefixes cannot make two different orders encode to the same bytes.
 */
@Component
public class OrderFingerprintService {

    /**
     * @return 32-byte fingerprint rendered as 0x-prefixed lower-case hex
     */
    public String fingerprint(SwapOrder order) {
        return Numeric.toHexString(fingerprintBytes(order));
    }

    public byte[] fingerprintBytes(SwapOrder order) {
        return AbiWords.builder()
            .uint256(order.getId())
            .packedAddress(order.getInitiator())
            .packedAddress(order.getCounterparty())
            .packedAddress(order.getAssetA())
            .packedAddress(order.getAssetB())
            .uint256(order.getAmountA())
            .uint256(order.getAmountB())
            .uint256(order.getExpiry())
            .keccak();
    }
}
