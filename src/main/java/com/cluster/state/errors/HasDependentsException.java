package com.cluster.state.errors;

/**
 * Raised when an entity cannot advance its life because others still depend on it.
 */
public class HasDependentsException extends StateException {

    public HasDependentsException(String message) {
        super(message);
    }
}
