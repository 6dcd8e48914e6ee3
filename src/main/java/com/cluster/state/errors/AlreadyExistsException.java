package com.cluster.state.errors;

/**
 * Raised when inserting an entity whose key is already taken.
 */
public class AlreadyExistsException extends ConflictException {

    public AlreadyExistsException(String message) {
        super(message);
    }
}
