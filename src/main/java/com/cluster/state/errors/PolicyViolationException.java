package com.cluster.state.errors;

/**
 * Raised when an operation is forbidden for the entity, such as destroying a controller machine
 * or placing a unit on a machine of another series.
 */
public class PolicyViolationException extends StateException {

    public PolicyViolationException(String message) {
        super(message);
    }
}
