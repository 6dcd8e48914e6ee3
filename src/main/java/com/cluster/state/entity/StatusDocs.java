package com.cluster.state.entity;

import com.cluster.state.core.model.AgentStatus;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent status documents of units and machines.
 */
final class StatusDocs {

    static final String STATUS = "status";
    static final String INFO = "info";

    private StatusDocs() {
    }

    static String unitKey(String unitName) {
        return "u#" + unitName;
    }

    static String machineKey(String machineId) {
        return "m#" + machineId;
    }

    static TxnOp insertOp(String key, AgentStatus status) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(STATUS, status);
        doc.put(INFO, "");
        return TxnOp.on(CollectionNames.STATUSES, key)
                .assertThat(Condition.docMissing())
                .insert(doc);
    }

    static TxnOp setOp(String key, AgentStatus status, String info) {
        return TxnOp.on(CollectionNames.STATUSES, key)
                .assertThat(Condition.docExists())
                .update(new Update().set(STATUS, status).set(INFO, info != null ? info : ""));
    }

    static TxnOp removeOp(String key) {
        return TxnOp.on(CollectionNames.STATUSES, key).remove();
    }
}
