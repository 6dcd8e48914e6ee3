package com.cluster.state.errors;

/**
 * Raised when a machine still hosts containers.
 */
public class HasContainersException extends HasDependentsException {

    public HasContainersException(String message) {
        super(message);
    }
}
