package com.flagship.settlement_engine.swap;

/**
 * Lifecycle of a swap fingerprint.
 *
 * UNSEEN → EXECUTED
 * UNSEEN → CANCELLED
 *
 * Both outcomes are terminal and permanent; nothing ever returns a
 * fingerprint to UNSEEN.
 */
public enum SettlementStatus {
    /**
     * No outcome recorded. Implicit: there is no row for the fingerprint.
     */
    UNSEEN,

    /**
     * Counterparty settled the order and both legs moved.
     */
    EXECUTED,

    /**
     * Initiator withdrew the order before execution.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != UNSEEN;
    }
}
