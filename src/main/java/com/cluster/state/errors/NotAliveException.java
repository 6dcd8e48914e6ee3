package com.cluster.state.errors;

/**
 * Raised when an operation requires an Alive entity but it is Dying, Dead or gone.
 */
public class NotAliveException extends StateException {

    public NotAliveException(String message) {
        super(message);
    }
}
