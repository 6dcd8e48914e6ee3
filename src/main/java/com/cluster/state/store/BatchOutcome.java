package com.cluster.state.store;

/**
 * Result of submitting an atomic batch.
 */
public enum BatchOutcome {
    /**
     * All assertions held and every mutation was written.
     */
    APPLIED,

    /**
     * At least one assertion failed; nothing was written.
     */
    ABORTED
}
