package com.cluster.state.offer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

record OfferDoc(
        @JsonProperty("_id") String offerName,
        @JsonProperty("offer-uuid") String offerUUID,
        @JsonProperty("application-name") String applicationName,
        @JsonProperty("application-description") String applicationDescription,
        @JsonProperty("endpoints") Map<String, String> endpoints,
        @JsonProperty("txn-revno") long revno
) {
    static final String OFFER_UUID = "offer-uuid";
    static final String APPLICATION_NAME = "application-name";
    static final String APPLICATION_DESCRIPTION = "application-description";
    static final String ENDPOINTS = "endpoints";

    ApplicationOffer toOffer() {
        return new ApplicationOffer(offerUUID, offerName, applicationName, applicationDescription,
                endpoints == null ? Map.of() : endpoints);
    }
}
