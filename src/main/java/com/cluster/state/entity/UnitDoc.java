package com.cluster.state.entity;

import com.cluster.state.core.model.Life;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Stored form of a unit. Principals carry the id of their machine in
 * {@code machineid}; subordinates leave it empty and follow their principal.
 */
record UnitDoc(
        @JsonProperty("_id") String name,
        @JsonProperty("application") String application,
        @JsonProperty("series") String series,
        @JsonProperty("principal") String principal,
        @JsonProperty("subordinates") List<String> subordinates,
        @JsonProperty("machineid") String machineId,
        @JsonProperty("charmurl") String charmUrl,
        @JsonProperty("life") Life life,
        @JsonProperty("txn-revno") long revno
) {
    static final String PRINCIPAL = "principal";
    static final String SUBORDINATES = "subordinates";
    static final String MACHINE_ID = "machineid";
    static final String APPLICATION = "application";
    static final String CHARM_URL = "charmurl";

    UnitDoc {
        principal = principal != null ? principal : "";
        subordinates = subordinates != null ? List.copyOf(subordinates) : List.of();
        machineId = machineId != null ? machineId : "";
        charmUrl = charmUrl != null ? charmUrl : "";
        life = life != null ? life : Life.ALIVE;
    }

    boolean isPrincipal() {
        return principal.isEmpty();
    }
}
