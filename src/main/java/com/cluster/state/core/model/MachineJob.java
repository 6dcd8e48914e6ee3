package com.cluster.state.core.model;

/**
 * Responsibilities a machine agent may carry.
 */
public enum MachineJob {
    HOST_UNITS,
    MANAGE_MODEL
}
