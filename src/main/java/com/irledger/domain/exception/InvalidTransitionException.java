package com.irledger.domain.exception;

/**
 * Attempt to move a withdrawal request out of a terminal state
 */
public class InvalidTransitionException extends LedgerException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
