package com.cluster.state.errors;

/**
 * Raised when arguments fail validation before any transaction is attempted.
 */
public class NotValidException extends StateException {

    public NotValidException(String message) {
        super(message);
    }
}
