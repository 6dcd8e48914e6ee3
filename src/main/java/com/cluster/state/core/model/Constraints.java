package com.cluster.state.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Placement constraints of an application.
 *
 * @param container container type new units must be placed in, or {@code NONE}
 */
public record Constraints(@JsonProperty("container") ContainerType container) {

    public Constraints {
        container = container != null ? container : ContainerType.NONE;
    }

    public static Constraints none() {
        return new Constraints(ContainerType.NONE);
    }

    public static Constraints container(ContainerType type) {
        return new Constraints(type);
    }

    public boolean hasContainer() {
        return container.isContainer();
    }
}
