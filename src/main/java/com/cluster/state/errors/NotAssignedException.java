package com.cluster.state.errors;

/**
 * Raised when a unit has no machine assigned.
 */
public class NotAssignedException extends StateException {

    public NotAssignedException(String message) {
        super(message);
    }
}
