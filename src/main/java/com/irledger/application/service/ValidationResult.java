package com.irledger.application.service;

import io.vertx.core.Future;

import java.util.Collections;
import java.util.List;

/**
 * Result of validating an inbound command
 */
public record ValidationResult(boolean isValid, List<String> errors) {

    public static ValidationResult valid() {
        return new ValidationResult(true, Collections.emptyList());
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty()
                ? valid()
                : new ValidationResult(false, Collections.unmodifiableList(errors));
    }

    /**
     * Failed future carrying the errors, for use at the top of an async operation
     */
    public <T> Future<T> toFailure() {
        return Future.failedFuture(new IllegalArgumentException("Validation failed: " + errors));
    }
}
