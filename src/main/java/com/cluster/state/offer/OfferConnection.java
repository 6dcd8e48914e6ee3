package com.cluster.state.offer;

/**
 * A relation from a consuming model to an offer.
 */
public record OfferConnection(
        String offerUUID,
        long relationId,
        String relationKey,
        String username,
        String sourceModelUUID
) {
}
