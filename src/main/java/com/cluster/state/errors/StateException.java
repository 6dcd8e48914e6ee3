package com.cluster.state.errors;

/**
 * Base class of every error raised by the state layer.
 * All subclasses are unchecked so callers can match on the specific type they care about.
 */
public class StateException extends RuntimeException {

    public StateException(String message) {
        super(message);
    }

    public StateException(String message, Throwable cause) {
        super(message, cause);
    }
}
