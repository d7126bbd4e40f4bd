package com.irledger.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Type of a ledger transaction. Amounts are always recorded as positive
 * magnitudes; the type decides which way the balance moves.
 */
public enum TransactionType {
    DEPOSIT("Deposit", 1),
    WITHDRAWAL("Withdrawal", -1),
    EARNINGS("Earnings", 1),
    CREDIT("Credit", 1);

    private final String value;
    private final int direction;

    TransactionType(String value, int direction) {
        this.value = value;
        this.direction = direction;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isDebit() {
        return direction < 0;
    }

    /**
     * Balance delta produced by a transaction of this type
     */
    public BigDecimal balanceDelta(BigDecimal amount) {
        BigDecimal magnitude = amount.abs();
        return isDebit() ? magnitude.negate() : magnitude;
    }

    public static TransactionType fromValue(String value) {
        for (TransactionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + value);
    }

    public static boolean isValid(String value) {
        for (TransactionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
