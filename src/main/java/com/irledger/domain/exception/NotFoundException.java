package com.irledger.domain.exception;

/**
 * Referenced document does not exist. Retrying will not help.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String kind, String id) {
        return new NotFoundException(kind + " not found: " + id);
    }
}
