package com.cluster.state.entity;

import com.cluster.state.core.model.Constraints;
import com.cluster.state.core.model.Endpoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters for a new application. Use {@link #builder(String)} to create instances.
 */
public final class AddApplicationArgs {

    private final String name;
    private final String series;
    private final String charmUrl;
    private final boolean subordinate;
    private final List<Endpoint> endpoints;
    private final Constraints constraints;
    private final Map<String, Object> settings;
    private final boolean storageRequiresProvisioning;

    private AddApplicationArgs(Builder builder) {
        this.name = builder.name;
        this.series = builder.series;
        this.charmUrl = builder.charmUrl;
        this.subordinate = builder.subordinate;
        this.endpoints = List.copyOf(builder.endpoints);
        this.constraints = builder.constraints;
        this.settings = new LinkedHashMap<>(builder.settings);
        this.storageRequiresProvisioning = builder.storageRequiresProvisioning;
    }

    public String getName() {
        return name;
    }

    public String getSeries() {
        return series;
    }

    public String getCharmUrl() {
        return charmUrl;
    }

    public boolean isSubordinate() {
        return subordinate;
    }

    public List<Endpoint> getEndpoints() {
        return endpoints;
    }

    public Constraints getConstraints() {
        return constraints;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    public boolean isStorageRequiresProvisioning() {
        return storageRequiresProvisioning;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String series;
        private String charmUrl;
        private boolean subordinate;
        private final List<Endpoint> endpoints = new ArrayList<>();
        private Constraints constraints = Constraints.none();
        private final Map<String, Object> settings = new LinkedHashMap<>();
        private boolean storageRequiresProvisioning;

        private Builder(String name) {
            this.name = name;
        }

        public Builder series(String series) {
            this.series = series;
            return this;
        }

        public Builder charmUrl(String charmUrl) {
            this.charmUrl = charmUrl;
            return this;
        }

        public Builder subordinate(boolean subordinate) {
            this.subordinate = subordinate;
            return this;
        }

        public Builder endpoint(Endpoint endpoint) {
            this.endpoints.add(endpoint);
            return this;
        }

        public Builder constraints(Constraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder setting(String key, Object value) {
            this.settings.put(key, value);
            return this;
        }

        /**
         * Marks units of the application as needing storage attached at
         * provisioning time, so they cannot go onto machines that already run.
         */
        public Builder storageRequiresProvisioning(boolean required) {
            this.storageRequiresProvisioning = required;
            return this;
        }

        public AddApplicationArgs build() {
            Objects.requireNonNull(series, "series is required");
            Objects.requireNonNull(charmUrl, "charmUrl is required");
            return new AddApplicationArgs(this);
        }
    }
}
