package com.cluster.state.network;

import java.util.Locale;

/**
 * Which side of a cross-model relation a set of CIDRs applies to.
 */
public enum RelationNetworkDirection {
    INGRESS,
    EGRESS;

    String prefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
