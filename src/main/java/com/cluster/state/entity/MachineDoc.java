package com.cluster.state.entity;

import com.cluster.state.core.model.ContainerType;
import com.cluster.state.core.model.Life;
import com.cluster.state.core.model.MachineJob;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Stored form of a machine. A machine is clean until it has hosted a unit or a container.
 */
record MachineDoc(
        @JsonProperty("_id") String id,
        @JsonProperty("series") String series,
        @JsonProperty("jobs") List<MachineJob> jobs,
        @JsonProperty("principals") List<String> principals,
        @JsonProperty("clean") boolean clean,
        @JsonProperty("hasvote") boolean hasVote,
        @JsonProperty("containertype") ContainerType containerType,
        @JsonProperty("instanceid") String instanceId,
        @JsonProperty("life") Life life,
        @JsonProperty("txn-revno") long revno
) {
    static final String SERIES = "series";
    static final String JOBS = "jobs";
    static final String PRINCIPALS = "principals";
    static final String CLEAN = "clean";
    static final String HAS_VOTE = "hasvote";
    static final String CONTAINER_TYPE = "containertype";
    static final String INSTANCE_ID = "instanceid";

    MachineDoc {
        jobs = jobs != null ? List.copyOf(jobs) : List.of();
        principals = principals != null ? List.copyOf(principals) : List.of();
        containerType = containerType != null ? containerType : ContainerType.NONE;
        instanceId = instanceId != null ? instanceId : "";
        life = life != null ? life : Life.ALIVE;
    }

    boolean hasJob(MachineJob job) {
        return jobs.contains(job);
    }
}
