package com.tracegate.core.store;

/**
 * Unexpected failure of the underlying storage (connection loss, malformed row, ...).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
