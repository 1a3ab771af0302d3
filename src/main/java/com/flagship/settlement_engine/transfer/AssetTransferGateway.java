package com.flagship.settlement_engine.transfer;

/**
 * Host primitive that moves assets between holders.
 *
 * Implementations are untrusted: they may decline, throw, or call back
 * into the engine before returning. Callers must have flipped their
 * authoritative state before invoking a transfer and must treat both a
 * {@code false} result and an exception as failure of the whole operation.
 */
public interface AssetTransferGateway {

    /**
     * Moves {@code leg.amount} of {@code leg.asset} from {@code leg.from} to {@code leg.to}.
     *
     * @param leg the movement to perform
     * @param operator identity pulling the funds; when it differs from
     *                 {@code leg.from} the holder must have approved it
     * @return true if the transfer was performed, false if it was declined
     */
    boolean transfer(TransferLeg leg, String operator);
}
