package com.cluster.state.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One side of a relation: an application's named endpoint, its role and interface.
 */
public record Endpoint(
        @JsonProperty("application") String applicationName,
        @JsonProperty("name") String name,
        @JsonProperty("role") EndpointRole role,
        @JsonProperty("interface") String interfaceName,
        @JsonProperty("scope") RelationScope scope
) {
    public Endpoint {
        Objects.requireNonNull(applicationName, "applicationName is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(interfaceName, "interfaceName is required");
        scope = scope != null ? scope : RelationScope.GLOBAL;
    }

    public static Endpoint of(String applicationName, String name, EndpointRole role, String interfaceName) {
        return new Endpoint(applicationName, name, role, interfaceName, RelationScope.GLOBAL);
    }

    /**
     * Returns whether this endpoint can form a relation with {@code other}.
     */
    public boolean canRelateTo(Endpoint other) {
        return !applicationName.equals(other.applicationName)
                && interfaceName.equals(other.interfaceName)
                && role != EndpointRole.PEER
                && role.counterpart() == other.role;
    }

    @Override
    public String toString() {
        return applicationName + ":" + name;
    }
}
