package com.cluster.state.core.model;

/**
 * Kind of container a machine is, or {@link #NONE} for a top-level machine.
 */
public enum ContainerType {
    NONE,
    LXD,
    KVM;

    public boolean isContainer() {
        return this != NONE;
    }
}
