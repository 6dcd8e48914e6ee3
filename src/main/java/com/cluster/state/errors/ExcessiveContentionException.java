package com.cluster.state.errors;

/**
 * Raised when a transaction kept aborting because the state it depends on
 * was changing faster than the retry budget allowed.
 */
public class ExcessiveContentionException extends StateException {

    private final int attempts;

    public ExcessiveContentionException(String operation, int attempts) {
        super("cannot complete " + operation + ": state changing too quickly; try again soon");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
