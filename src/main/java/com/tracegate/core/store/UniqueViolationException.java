package com.tracegate.core.store;

/**
 * Raised by a store when a write would break one of its uniqueness constraints.
 * The losing writer of a concurrent race receives this exception.
 */
public class UniqueViolationException extends RuntimeException {

    public UniqueViolationException(String message) {
        super(message);
    }

    public UniqueViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
