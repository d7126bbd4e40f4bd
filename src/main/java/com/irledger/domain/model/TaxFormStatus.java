package com.irledger.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * W-8BEN review status of a withdrawal request, tracked independently of the request status
 */
public enum TaxFormStatus {
    NOT_REQUIRED("not_required"),
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String value;

    TaxFormStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TaxFormStatus fromValue(String value) {
        for (TaxFormStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown W-8BEN status: " + value);
    }

    public static boolean isValid(String value) {
        for (TaxFormStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
