package com.flagship.settlement_engine.authorization;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.common.Uint256;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * EIP-712 domain that every swap signature is bound to.
 *
 * A signature produced for another protocol name, version, network or
 * verifying service recovers to a different signer here.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SigningDomain {

    static final String DOMAIN_TYPE =
        "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";

    private final String name;
    private final String version;
    private final BigInteger chainId;
    private final String verifyingContract;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final byte[] separator;

    public SigningDomain(String name, String version, BigInteger chainId, String verifyingContract) {
        if (name == null || version == null) {
            throw new IllegalArgumentException("Domain name and version are required");
        }
        this.name = name;
        this.version = version;
        this.chainId = Uint256.require(chainId, "chainId");
        this.verifyingContract = Addresses.normalize(verifyingContract);
        this.separator = AbiWords.builder()
            .bytes(AbiWords.keccak(DOMAIN_TYPE))
            .bytes(AbiWords.keccak(name))
            .bytes(AbiWords.keccak(version))
            .uint256(this.chainId)
            .paddedAddress(this.verifyingContract)
            .keccak();
    }

    public byte[] getSeparator() {
        return separator.clone();
    }
}
