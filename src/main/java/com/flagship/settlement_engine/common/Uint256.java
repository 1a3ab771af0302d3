package com.flagship.settlement_engine.common;

import java.math.BigInteger;

/**
 * Range checks for unsigned 256-bit quantities (ids, amounts, expiries).
 */
public final class Uint256 {

    public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Uint256() {
        // Utility class
    }

    public static boolean isValid(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(MAX_VALUE) <= 0;
    }

    /**
     * @throws IllegalArgumentException if the value does not fit in an unsigned 256-bit word
     */
    public static BigInteger require(BigInteger value, String field) {
        if (!isValid(value)) {
            throw new IllegalArgumentException(field + " must be an unsigned 256-bit integer, got: " + value);
        }
        return value;
    }
}
