package com.cluster.state.cleanup;

/**
 * Deferred work scheduled when an entity becomes Dying.
 */
public enum CleanupKind {
    /** Destroy the subordinates of a dying unit. */
    DYING_UNIT,
    /** Destroy every unit of a dying application. */
    UNITS_FOR_DYING_APPLICATION,
    /** Remove dead principals of a dying machine and destroy the rest. */
    DYING_MACHINE
}
