package com.irledger.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority attached to an affiliate message
 */
public enum MessagePriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    MessagePriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MessagePriority fromValue(String value) {
        for (MessagePriority candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown message priority: " + value);
    }

    public static boolean isValid(String value) {
        for (MessagePriority candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
