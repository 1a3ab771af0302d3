package com.flagship.settlement_engine.error;

import org.springframework.http.HttpStatus;

/**
 * Families of settlement failures, each with the HTTP status it maps to.
 */
public enum ErrorCategory {

    /** Wrong signature or wrong caller. Resubmit with the right credentials. */
    AUTHORIZATION(HttpStatus.FORBIDDEN),

    /** The caller's view of ledger state is stale. Refresh before resubmitting. */
    STATE_CONFLICT(HttpStatus.CONFLICT),

    /** Defective input values. */
    VALUE(HttpStatus.UNPROCESSABLE_ENTITY),

    /** The asset-transfer primitive declined or failed. */
    EXTERNAL_DEPENDENCY(HttpStatus.BAD_GATEWAY),

    /** A guarded operation was entered while another one was still running. */
    REENTRANCY(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;

    ErrorCategory(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
