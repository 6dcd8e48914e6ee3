package com.cluster.state.errors;

/**
 * Raised when removal is requested for an entity that is not yet Dead.
 */
public class NotDeadException extends StateException {

    public NotDeadException(String message) {
        super(message);
    }
}
