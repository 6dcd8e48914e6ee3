package com.cluster.state.core.model;

public enum EndpointRole {
    PROVIDER,
    REQUIRER,
    PEER;

    /**
     * Returns the role an endpoint must have to relate to one with this role.
     */
    public EndpointRole counterpart() {
        return switch (this) {
            case PROVIDER -> REQUIRER;
            case REQUIRER -> PROVIDER;
            case PEER -> PEER;
        };
    }
}
