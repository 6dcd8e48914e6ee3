package com.cluster.state.errors;

/**
 * Raised when a referenced entity or document does not exist.
 */
public class NotFoundException extends StateException {

    public NotFoundException(String message) {
        super(message);
    }
}
