package com.irledger.application.service;

/**
 * What {@code process} does when asked to decide a request that is already Approved or Rejected
 */
public enum TerminalTransitionPolicy {
    /** Fail with InvalidTransitionException */
    REJECT("reject"),
    /** Log and complete without changing anything */
    IGNORE("ignore");

    private final String value;

    TerminalTransitionPolicy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TerminalTransitionPolicy fromValue(String value) {
        for (TerminalTransitionPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown terminal transition policy: " + value);
    }
}
