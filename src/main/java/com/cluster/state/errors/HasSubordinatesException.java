package com.cluster.state.errors;

/**
 * Raised when a unit cannot become Dead while subordinate units remain.
 */
public class HasSubordinatesException extends HasDependentsException {

    public HasSubordinatesException(String message) {
        super(message);
    }
}
