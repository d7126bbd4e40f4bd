package com.irledger.domain.exception;

/**
 * A compare-and-set write kept losing to concurrent writers
 */
public class WriteConflictException extends LedgerException {

    public WriteConflictException(String message) {
        super(message);
    }
}
