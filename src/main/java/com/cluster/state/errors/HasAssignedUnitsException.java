package com.cluster.state.errors;

/**
 * Raised when a machine still hosts principal units.
 */
public class HasAssignedUnitsException extends HasDependentsException {

    public HasAssignedUnitsException(String message) {
        super(message);
    }
}
