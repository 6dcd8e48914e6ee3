package com.cluster.state.core.model;

/**
 * Strategy used to pick a machine for a unit.
 */
public enum AssignmentPolicy {
    /**
     * Place the unit on the controller's local machine ("0").
     */
    LOCAL,

    /**
     * Reuse a machine that has never hosted a unit, falling back to a new machine.
     */
    CLEAN,

    /**
     * Reuse a clean machine without containers, falling back to a new machine.
     */
    CLEAN_EMPTY,

    /**
     * Always provision a new machine (or container, if constrained).
     */
    NEW
}
