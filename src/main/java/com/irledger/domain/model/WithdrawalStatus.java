package com.irledger.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Primary status of a withdrawal request. Approved and Rejected are terminal.
 */
public enum WithdrawalStatus {
    PENDING("Pending"),
    APPROVED("Approved"),
    REJECTED("Rejected");

    private final String value;

    WithdrawalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static WithdrawalStatus fromValue(String value) {
        for (WithdrawalStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown withdrawal status: " + value);
    }

    public static boolean isValid(String value) {
        for (WithdrawalStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
