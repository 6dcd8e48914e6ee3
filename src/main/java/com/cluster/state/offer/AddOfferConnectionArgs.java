package com.cluster.state.offer;

import java.util.Objects;

public record AddOfferConnectionArgs(
        String sourceModelUUID,
        long relationId,
        String relationKey,
        String offerUUID,
        String username
) {

    public AddOfferConnectionArgs {
        Objects.requireNonNull(sourceModelUUID, "sourceModelUUID is required");
        Objects.requireNonNull(relationKey, "relationKey is required");
        Objects.requireNonNull(offerUUID, "offerUUID is required");
        Objects.requireNonNull(username, "username is required");
    }
}
