package com.cluster.state.errors;

/**
 * Raised when a candidate machine stopped being clean or acceptable.
 */
public class MachineInUseException extends ConflictException {

    public MachineInUseException(String message) {
        super(message);
    }
}
