package com.flagship.settlement_engine.authorization;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.error.SettlementError;
import com.flagship.settlement_engine.error.SettlementException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Verifies that a swap order was authorized by its initiator.
 *
 * The initiator signs the EIP-712 digest of the order under the configured
 * {@link SigningDomain}. This class rebuilds that digest and recovers the
 * signer's address from a 65-byte {@code r || s || v} signature using
 * web3j's secp256k1 recovery.
 *
 * Note the digest is not the fingerprint: the fingerprint keys settlement
 * state, the digest is what was signed and carries the domain separator.
 */
@Component
@Slf4j
public class AuthorizationVerifier {

    static final String SWAP_TYPE =
        "Swap(uint256 swapId,address initiator,address counterparty,address tokenX,address tokenY,"
            + "uint256 amountX,uint256 amountY,uint256 expiration)";

    private static final byte[] SWAP_TYPE_HASH = AbiWords.keccak(SWAP_TYPE);
    private static final byte[] EIP712_PREFIX = {0x19, 0x01};

    private static final int SIGNATURE_LENGTH = 65;
    private static final Pattern HEX = Pattern.compile("^(0x)?[0-9a-fA-F]*$");

    // secp256k1 group order
    private static final BigInteger CURVE_ORDER =
        new BigInteger("FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFEBAAEDCE6AF48A03BBFD25E8CD0364141", 16);
    private static final BigInteger HALF_CURVE_ORDER = CURVE_ORDER.shiftRight(1);

    private final SigningDomain domain;
    private final OrderFingerprintService fingerprintService;

    public AuthorizationVerifier(SigningDomain domain, OrderFingerprintService fingerprintService) {
        this.domain = domain;
        this.fingerprintService = fingerprintService;
    }

    public SigningDomain getDomain() {
        return domain;
    }

    /**
     * Computes the EIP-712 digest of an order under this verifier's domain.
     */
    public byte[] signingHash(SwapOrder order) {
        byte[] structHash = AbiWords.builder()
            .bytes(SWAP_TYPE_HASH)
            .uint256(order.getId())
            .paddedAddress(order.getInitiator())
            .paddedAddress(order.getCounterparty())
            .paddedAddress(order.getAssetA())
            .paddedAddress(order.getAssetB())
            .uint256(order.getAmountA())
            .uint256(order.getAmountB())
            .uint256(order.getExpiry())
            .keccak();

        return AbiWords.builder()
            .bytes(EIP712_PREFIX)
            .bytes(domain.getSeparator())
            .bytes(structHash)
            .keccak();
    }

    public OrderDigest digest(SwapOrder order) {
        return new OrderDigest(
            fingerprintService.fingerprint(order),
            Numeric.toHexString(signingHash(order)));
    }

    /**
     * Recovers the address that produced {@code signature} over the order's digest.
     *
     * @throws SettlementException INVALID_SIGNATURE if the signature is malformed,
     *         non-canonical or does not recover to any key
     */
    public String recoverSigner(SwapOrder order, String signature) {
        Sign.SignatureData signatureData = parse(signature);
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(signingHash(order), signatureData);
            return Addresses.normalize("0x" + Keys.getAddress(publicKey));
        } catch (SignatureException | RuntimeException e) {
            log.debug("Signature recovery failed: {}", e.getMessage());
            throw invalid("Signature does not recover to a signer");
        }
    }

    /**
     * @throws SettlementException INVALID_SIGNATURE unless the order was signed by {@code expectedSigner}
     */
    public void requireSignedBy(SwapOrder order, String signature, String expectedSigner) {
        String signer = recoverSigner(order, signature);
        if (!Addresses.sameIdentity(signer, expectedSigner)) {
            log.debug("Signature recovered to {} but {} was expected", signer, expectedSigner);
            throw invalid("Signature was not produced by the order initiator");
        }
    }

    private Sign.SignatureData parse(String signature) {
        if (signature == null || !HEX.matcher(signature).matches()) {
            throw invalid("Signature must be hex encoded");
        }
        byte[] raw = Numeric.hexStringToByteArray(signature);
        if (raw.length != SIGNATURE_LENGTH) {
            throw invalid("Signature must be 65 bytes, got " + raw.length);
        }

        byte[] r = Arrays.copyOfRange(raw, 0, 32);
        byte[] s = Arrays.copyOfRange(raw, 32, 64);
        int v = raw[64] & 0xFF;
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw invalid("Signature recovery id out of range: " + (raw[64] & 0xFF));
        }

        BigInteger rValue = new BigInteger(1, r);
        BigInteger sValue = new BigInteger(1, s);
        if (rValue.signum() == 0 || rValue.compareTo(CURVE_ORDER) >= 0) {
            throw invalid("Signature r value out of range");
        }
        if (sValue.signum() == 0 || sValue.compareTo(HALF_CURVE_ORDER) > 0) {
            throw invalid("Signature s value out of range");
        }
        return new Sign.SignatureData((byte) v, r, s);
    }

    private static SettlementException invalid(String message) {
        return SettlementException.of(SettlementError.INVALID_SIGNATURE, message);
    }
}
