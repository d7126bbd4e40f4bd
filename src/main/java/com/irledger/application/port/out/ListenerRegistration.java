package com.irledger.application.port.out;

/**
 * Handle of a live store listener
 */
@FunctionalInterface
public interface ListenerRegistration {

    /**
     * Stop delivery. Safe to call more than once.
     */
    void remove();
}
