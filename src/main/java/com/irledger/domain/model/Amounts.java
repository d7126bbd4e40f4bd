package com.irledger.domain.model;

import java.math.BigDecimal;

/**
 * Conversion between {@link BigDecimal} amounts and the plain JSON numbers
 * kept in store documents.
 */
public final class Amounts {

    private Amounts() {
    }

    public static BigDecimal fromDocument(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number || value instanceof String) {
            return new BigDecimal(value.toString());
        }
        throw new IllegalArgumentException("Not a numeric amount: " + value);
    }

    public static Number toDocument(BigDecimal amount) {
        if (amount == null) {
            return 0;
        }
        return amount.doubleValue();
    }
}
