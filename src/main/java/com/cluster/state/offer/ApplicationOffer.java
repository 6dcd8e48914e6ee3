package com.cluster.state.offer;

import java.util.Map;

/**
 * An application published for consumption by other models. {@code endpoints}
 * maps the offered alias to the application's endpoint name.
 */
public record ApplicationOffer(
        String offerUUID,
        String offerName,
        String applicationName,
        String applicationDescription,
        Map<String, String> endpoints
) {

    public ApplicationOffer {
        endpoints = Map.copyOf(endpoints);
    }
}
