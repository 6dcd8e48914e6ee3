package com.cluster.state.offer;

/**
 * One term of an offer query. Null fields match anything; the offer name
 * matches partially and the description by containment.
 */
public record OfferFilter(String offerName, String applicationName, String applicationDescription,
                          String endpointName) {

    public static OfferFilter byApplication(String applicationName) {
        return new OfferFilter(null, applicationName, null, null);
    }

    public static OfferFilter byOfferName(String offerName) {
        return new OfferFilter(offerName, null, null, null);
    }

    boolean matches(ApplicationOffer offer) {
        if (isSet(offerName) && !offer.offerName().contains(offerName)) {
            return false;
        }
        if (isSet(applicationName) && !offer.applicationName().equals(applicationName)) {
            return false;
        }
        if (isSet(applicationDescription) && !offer.applicationDescription().contains(applicationDescription)) {
            return false;
        }
        return !isSet(endpointName) || offer.endpoints().containsValue(endpointName);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
