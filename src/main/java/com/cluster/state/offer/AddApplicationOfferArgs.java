package com.cluster.state.offer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments for adding or updating an application offer.
 */
public final class AddApplicationOfferArgs {

    private final String offerName;
    private final String applicationName;
    private final String applicationDescription;
    private final Map<String, String> endpoints;

    private AddApplicationOfferArgs(Builder builder) {
        this.offerName = builder.offerName;
        this.applicationName = builder.applicationName;
        this.applicationDescription = builder.applicationDescription;
        this.endpoints = Map.copyOf(builder.endpoints);
    }

    public static Builder builder(String offerName, String applicationName) {
        return new Builder(offerName, applicationName);
    }

    public String getOfferName() {
        return offerName;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public String getApplicationDescription() {
        return applicationDescription;
    }

    public Map<String, String> getEndpoints() {
        return endpoints;
    }

    public static class Builder {
        private final String offerName;
        private final String applicationName;
        private String applicationDescription = "";
        private final Map<String, String> endpoints = new LinkedHashMap<>();

        private Builder(String offerName, String applicationName) {
            this.offerName = Objects.requireNonNull(offerName, "offerName is required");
            this.applicationName = Objects.requireNonNull(applicationName, "applicationName is required");
        }

        public Builder description(String description) {
            this.applicationDescription = Objects.requireNonNull(description);
            return this;
        }

        /**
         * Offers the application's {@code endpointName} under {@code alias}.
         */
        public Builder endpoint(String alias, String endpointName) {
            endpoints.put(alias, endpointName);
            return this;
        }

        public AddApplicationOfferArgs build() {
            return new AddApplicationOfferArgs(this);
        }
    }
}
