package com.cluster.state.entity;

import com.cluster.state.core.model.Endpoint;
import com.cluster.state.core.model.Life;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Stored form of a relation; {@code unitcount} is the number of units in scope.
 */
record RelationDoc(
        @JsonProperty("_id") String key,
        @JsonProperty("id") long id,
        @JsonProperty("endpoints") List<Endpoint> endpoints,
        @JsonProperty("applications") List<String> applications,
        @JsonProperty("unitcount") long unitCount,
        @JsonProperty("life") Life life,
        @JsonProperty("txn-revno") long revno
) {
    static final String ID = "id";
    static final String APPLICATIONS = "applications";
    static final String UNIT_COUNT = "unitcount";

    RelationDoc {
        endpoints = endpoints != null ? List.copyOf(endpoints) : List.of();
        applications = applications != null ? List.copyOf(applications) : List.of();
        life = life != null ? life : Life.ALIVE;
    }
}
