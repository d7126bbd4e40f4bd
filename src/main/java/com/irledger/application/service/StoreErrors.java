package com.irledger.application.service;

import com.irledger.domain.exception.InvalidTransitionException;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.exception.StoreUnavailableException;
import com.irledger.domain.exception.WriteConflictException;
import io.vertx.core.Future;

import java.util.function.Function;

/**
 * Error translation for one-shot operations: store failures are re-raised
 * with an operation-specific message, while outcomes that retrying cannot
 * change pass through untouched.
 *
 * <p>When one operation is built on another, the outer label replaces the
 * inner one, so the message names the operation the caller asked for and
 * the store's own error once.
 */
final class StoreErrors {

    private StoreErrors() {
    }

    static <T> Function<Throwable, Future<T>> wrap(String operation) {
        return error -> {
            if (error instanceof NotFoundException
                    || error instanceof InvalidTransitionException
                    || error instanceof WriteConflictException
                    || error instanceof IllegalArgumentException) {
                return Future.failedFuture(error);
            }
            if (error instanceof OperationFailedException wrapped) {
                return Future.failedFuture(new OperationFailedException(operation, wrapped.detail, wrapped.getCause()));
            }
            String detail = error.getMessage() != null ? error.getMessage() : "Unknown error";
            return Future.failedFuture(new OperationFailedException(operation, detail, error));
        };
    }

    private static final class OperationFailedException extends StoreUnavailableException {

        private final String detail;

        OperationFailedException(String operation, String detail, Throwable cause) {
            super(operation + ": " + detail, cause);
            this.detail = detail;
        }
    }
}
