package com.irledger.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a message author
 */
public enum SenderRole {
    ADMIN("admin"),
    AFFILIATE("affiliate");

    private final String value;

    SenderRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static SenderRole fromValue(String value) {
        for (SenderRole candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown sender role: " + value);
    }

    public static boolean isValid(String value) {
        for (SenderRole candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
