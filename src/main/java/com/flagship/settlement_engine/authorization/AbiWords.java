package com.flagship.settlement_engine.authorization;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Byte encodings shared by fingerprinting and typed-data signing.
 *
 * Packed encoding writes a uint256 as one 32-byte word and an address as
 * its 20 raw bytes. Word encoding writes every field as a 32-byte word,
 * addresses left-padded with zeros.
 */
final class AbiWords {

    static final int WORD_SIZE = 32;
    static final int ADDRESS_SIZE = 20;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private AbiWords() {
    }

    static AbiWords builder() {
        return new AbiWords();
    }

    AbiWords uint256(BigInteger value) {
        write(Numeric.toBytesPadded(value, WORD_SIZE));
        return this;
    }

    AbiWords packedAddress(String address) {
        write(addressBytes(address));
        return this;
    }

    AbiWords paddedAddress(String address) {
        write(new byte[WORD_SIZE - ADDRESS_SIZE]);
        write(addressBytes(address));
        return this;
    }

    AbiWords bytes(byte[] raw) {
        write(raw);
        return this;
    }

    byte[] toByteArray() {
        return buffer.toByteArray();
    }

    byte[] keccak() {
        return Hash.sha3(toByteArray());
    }

    static byte[] keccak(String utf8) {
        return Hash.sha3(utf8.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] addressBytes(String address) {
        byte[] raw = Numeric.hexStringToByteArray(address);
        if (raw.length != ADDRESS_SIZE) {
            throw new IllegalArgumentException("Address must be 20 bytes: " + address);
        }
        return raw;
    }

    private void write(byte[] raw) {
        buffer.write(raw, 0, raw.length);
    }
}
