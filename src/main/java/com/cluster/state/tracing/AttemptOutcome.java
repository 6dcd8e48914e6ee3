package com.cluster.state.tracing;

/**
 * How a single transaction attempt ended.
 */
public enum AttemptOutcome {

    /** The batch was applied. */
    APPLIED("applied"),

    /** An assertion in the batch no longer held and nothing was written. */
    ASSERT_FAILED("assert-failed"),

    /** The builder saw inconsistent state and asked for another attempt. */
    TRANSIENT("transient"),

    /** The builder returned no ops. */
    NOTHING_TO_DO("nothing-to-do");

    private final String label;

    AttemptOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
