package com.flagship.settlement_engine.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for 20-byte account addresses (identities and asset handles).
 *
 * Addresses are compared in their normalised form: "0x" followed by
 * 40 lower-case hex characters. Checksum casing is accepted on input
 * but not verified.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
        // Utility class
    }

    public static boolean isValid(String value) {
        return value != null && ADDRESS.matcher(value).matches();
    }

    /**
     * Normalises an address to lower case.
     *
     * @throws IllegalArgumentException if the value is not a 20-byte hex address
     */
    public static String normalize(String value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Not a 20-byte hex address: " + value);
        }
        return value.toLowerCase(Locale.ROOT);
    }

    public static boolean sameIdentity(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }
}
