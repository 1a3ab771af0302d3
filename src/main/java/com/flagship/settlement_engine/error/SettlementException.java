package com.flagship.settlement_engine.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejection of a ledger operation.
 *
 * Thrown inside the operation's transaction, so every effect the operation
 * already staged (state flips, balance changes, outbox events) is rolled back.
 */
public class SettlementException extends RuntimeException {

    private final SettlementError error;
    private final Map<String, String> details;

    public SettlementException(SettlementError error, String message) {
        this(error, message, Map.of(), null);
    }

    public SettlementException(SettlementError error, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static SettlementException of(SettlementError error, String message) {
        return new SettlementException(error, message);
    }

    /**
     * A transfer leg was declined. Leg A is index 0, leg B is index 1.
     */
    public static SettlementException transferFailed(int legIndex, Throwable cause) {
        String message = cause == null
            ? String.format("Transfer leg %d was declined", legIndex)
            : String.format("Transfer leg %d failed: %s", legIndex, cause.getMessage());
        return new SettlementException(SettlementError.TRANSFER_FAILED, message,
            Map.of("legIndex", String.valueOf(legIndex)), cause);
    }

    public SettlementError getError() {
        return error;
    }

    public ErrorCategory getCategory() {
        return error.category();
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
