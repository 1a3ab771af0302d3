package com.flagship.settlement_engine.transfer;

/**
 * Side of an asset ledger entry. Every transfer writes one DEBIT on the
 * sender and one CREDIT on the receiver for the same amount.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
