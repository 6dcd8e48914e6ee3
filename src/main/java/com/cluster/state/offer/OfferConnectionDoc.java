package com.cluster.state.offer;

import com.fasterxml.jackson.annotation.JsonProperty;

record OfferConnectionDoc(
        @JsonProperty("_id") String id,
        @JsonProperty("offer-uuid") String offerUUID,
        @JsonProperty("relation-id") long relationId,
        @JsonProperty("relation-key") String relationKey,
        @JsonProperty("username") String username,
        @JsonProperty("source-model-uuid") String sourceModelUUID,
        @JsonProperty("txn-revno") long revno
) {
    static final String OFFER_UUID = "offer-uuid";
    static final String RELATION_KEY = "relation-key";

    OfferConnection toConnection() {
        return new OfferConnection(offerUUID, relationId, relationKey, username, sourceModelUUID);
    }
}
