package com.cluster.state.core.model;

/**
 * Lifecycle stage shared by every long-lived entity.
 * Life only ever moves forward: ALIVE, then DYING, then DEAD. Physical removal
 * of a DEAD entity is a separate, explicit step.
 */
public enum Life {
    /**
     * Entity is in normal operation.
     */
    ALIVE,

    /**
     * Entity has been asked to go away; its dependents are being wound down.
     */
    DYING,

    /**
     * Entity has no remaining responsibilities and may be removed.
     */
    DEAD;

    public boolean isAtLeast(Life other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * Returns the later of this life and {@code target}; never moves backward.
     */
    public Life advanceTo(Life target) {
        return target.ordinal() > ordinal() ? target : this;
    }
}
