package com.cluster.state.network;

import java.util.List;

/**
 * The CIDRs recorded for one relation in one direction.
 */
public record RelationNetwork(String relationKey, RelationNetworkDirection direction, List<String> cidrs) {

    public RelationNetwork {
        cidrs = List.copyOf(cidrs);
    }
}
