package com.cluster.state.core.model;

/**
 * Reach of a relation: model-wide, or confined to the units sharing a container.
 */
public enum RelationScope {
    GLOBAL,
    CONTAINER
}
