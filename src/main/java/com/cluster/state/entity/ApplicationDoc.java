package com.cluster.state.entity;

import com.cluster.state.core.model.Constraints;
import com.cluster.state.core.model.Endpoint;
import com.cluster.state.core.model.Life;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Stored form of an application, including the counters that decide when a
 * Dying application may be removed.
 */
record ApplicationDoc(
        @JsonProperty("_id") String name,
        @JsonProperty("series") String series,
        @JsonProperty("subordinate") boolean subordinate,
        @JsonProperty("charmurl") String charmUrl,
        @JsonProperty("endpoints") List<Endpoint> endpoints,
        @JsonProperty("constraints") Constraints constraints,
        @JsonProperty("storage-requires-provisioning") boolean storageRequiresProvisioning,
        @JsonProperty("unitcount") long unitCount,
        @JsonProperty("relationcount") long relationCount,
        @JsonProperty("life") Life life,
        @JsonProperty("txn-revno") long revno
) {
    static final String CHARM_URL = "charmurl";
    static final String UNIT_COUNT = "unitcount";
    static final String RELATION_COUNT = "relationcount";

    ApplicationDoc {
        endpoints = endpoints != null ? List.copyOf(endpoints) : List.of();
        constraints = constraints != null ? constraints : Constraints.none();
        life = life != null ? life : Life.ALIVE;
    }
}
