package com.tracegate.core.error;

/**
 * Thrown when a suite membership, plan entry or scope declaration already exists.
 * Surfaced to callers as a conflict; never retried or ignored.
 */
public class DuplicateAssociationException extends RuntimeException {

    public DuplicateAssociationException(String message) {
        super(message);
    }

    public DuplicateAssociationException(String message, Throwable cause) {
        super(message, cause);
    }
}
