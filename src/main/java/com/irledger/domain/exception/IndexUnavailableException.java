package com.irledger.domain.exception;

/**
 * An ordered query needs a store index that has not been provisioned.
 * Always recovered by the change feed through its in-memory sort.
 */
public class IndexUnavailableException extends LedgerException {

    public IndexUnavailableException(String message) {
        super(message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
