package com.irledger.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery status of an affiliate message
 */
public enum MessageStatus {
    SENT("sent"),
    DELIVERED("delivered"),
    READ("read");

    private final String value;

    MessageStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MessageStatus fromValue(String value) {
        for (MessageStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown message status: " + value);
    }

    public static boolean isValid(String value) {
        for (MessageStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
