package com.tracegate.core.error;

/**
 * Thrown when a create operation names an id that is already taken. Existing entities are
 * never replaced by a create.
 */
public class AlreadyExistsException extends RuntimeException {

    public AlreadyExistsException(String entityType, String entityId, Throwable cause) {
        super(entityType + " already exists: " + entityId, cause);
    }
}
