package com.cluster.state.errors;

/**
 * A write could not be applied because it collides with existing state.
 */
public class ConflictException extends StateException {

    public ConflictException(String message) {
        super(message);
    }
}
