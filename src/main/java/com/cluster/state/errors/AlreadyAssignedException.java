package com.cluster.state.errors;

/**
 * Raised when a unit is already assigned to a different machine.
 */
public class AlreadyAssignedException extends ConflictException {

    public AlreadyAssignedException(String message) {
        super(message);
    }
}
