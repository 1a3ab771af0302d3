package com.flagship.settlement_engine.swap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.authorization.OrderDigest;
import com.flagship.settlement_engine.authorization.SigningDomain;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * What a client needs to sign an order: the digest plus the domain it is bound to.
 */
@Value
@Builder
public class SwapDigestResponse {

    @JsonProperty("fingerprint")
    String fingerprint;

    @JsonProperty("signing_hash")
    String signingHash;

    @JsonProperty("domain_name")
    String domainName;

    @JsonProperty("domain_version")
    String domainVersion;

    @JsonProperty("chain_id")
    BigInteger chainId;

    @JsonProperty("verifying_contract")
    String verifyingContract;

    public static SwapDigestResponse from(OrderDigest digest, SigningDomain domain) {
        return SwapDigestResponse.builder()
            .fingerprint(digest.getFingerprint())
            .signingHash(digest.getSigningHash())
            .domainName(domain.getName())
            .domainVersion(domain.getVersion())
            .chainId(domain.getChainId())
            .verifyingContract(domain.getVerifyingContract())
            .build();
    }
}
