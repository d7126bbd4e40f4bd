package com.irledger.domain.exception;

/**
 * Network or permission failure talking to the document store. The operation may succeed on retry.
 */
public class StoreUnavailableException extends LedgerException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
