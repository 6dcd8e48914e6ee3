package com.cluster.state.core.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Parameters for a new machine. Use {@link #builder()} to create instances.
 */
public final class MachineTemplate {

    private final String series;
    private final Set<MachineJob> jobs;
    private final Constraints constraints;
    private final String instanceId;

    private MachineTemplate(Builder builder) {
        this.series = builder.series;
        this.jobs = Set.copyOf(builder.jobs);
        this.constraints = builder.constraints;
        this.instanceId = builder.instanceId;
    }

    public String getSeries() {
        return series;
    }

    public Set<MachineJob> getJobs() {
        return jobs;
    }

    public Constraints getConstraints() {
        return constraints;
    }

    /**
     * Instance id of an already provisioned machine, or empty.
     */
    public String getInstanceId() {
        return instanceId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MachineTemplate forSeries(String series) {
        return builder().series(series).build();
    }

    public static class Builder {
        private String series;
        private final Set<MachineJob> jobs = EnumSet.noneOf(MachineJob.class);
        private Constraints constraints = Constraints.none();
        private String instanceId = "";

        public Builder series(String series) {
            this.series = series;
            return this;
        }

        public Builder job(MachineJob job) {
            this.jobs.add(job);
            return this;
        }

        public Builder constraints(Constraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId != null ? instanceId : "";
            return this;
        }

        public MachineTemplate build() {
            Objects.requireNonNull(series, "series is required");
            if (series.isBlank()) {
                throw new IllegalArgumentException("series must not be blank");
            }
            if (jobs.isEmpty()) {
                jobs.add(MachineJob.HOST_UNITS);
            }
            return new MachineTemplate(this);
        }
    }
}
