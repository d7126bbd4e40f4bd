package com.irledger.domain.exception;

/**
 * Base type for failures raised by the ledger and synchronization layer
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
