package com.flagship.settlement_engine.authorization;

import lombok.Value;

/**
 * The two hashes derived from one order: the settlement key and the
 * EIP-712 digest the initiator signs.
 */
@Value
public class OrderDigest {
    String fingerprint;
    String signingHash;
}
