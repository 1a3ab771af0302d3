package com.flagship.settlement_engine.error;

/**
 * Every way a settlement, marketplace or escrow operation can be rejected.
 */
public enum SettlementError {
    INVALID_SIGNATURE(ErrorCategory.AUTHORIZATION),
    UNAUTHORIZED_CALLER(ErrorCategory.AUTHORIZATION),
    NOT_REGISTERED(ErrorCategory.AUTHORIZATION),

    EXPIRED(ErrorCategory.STATE_CONFLICT),
    ALREADY_SETTLED(ErrorCategory.STATE_CONFLICT),
    ALREADY_REGISTERED(ErrorCategory.STATE_CONFLICT),
    NAME_TAKEN(ErrorCategory.STATE_CONFLICT),
    ITEM_UNAVAILABLE(ErrorCategory.STATE_CONFLICT),

    INVALID_PRICE(ErrorCategory.VALUE),
    SELF_PURCHASE(ErrorCategory.VALUE),
    WRONG_PAYMENT_AMOUNT(ErrorCategory.VALUE),
    NOTHING_TO_WITHDRAW(ErrorCategory.VALUE),

    TRANSFER_FAILED(ErrorCategory.EXTERNAL_DEPENDENCY),
    WITHDRAWAL_TRANSFER_FAILED(ErrorCategory.EXTERNAL_DEPENDENCY),

    REENTRANT_CALL(ErrorCategory.REENTRANCY);

    private final ErrorCategory category;

    SettlementError(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
