package com.flagship.settlement_engine.transfer;

import lombok.Value;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Journal record of one side of an asset transfer. Immutable once written.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transferId;
    String asset;
    String holder;
    BigInteger amount;
    EntryType entryType;
    String description;
    Long sequenceNumber;
}
