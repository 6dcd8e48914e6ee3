package com.cluster.state.entity;

import com.cluster.state.core.model.Life;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.Documents;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The model every entity belongs to. Adding entities is refused once the model leaves Alive.
 */
public class Model {

    private static final String UUID = "uuid";
    private static final String NAME = "name";

    private final StateContext ctx;
    private final Map<String, Object> doc;

    Model(StateContext ctx, Map<String, Object> doc) {
        this.ctx = ctx;
        this.doc = doc;
    }

    /**
     * Builds the insert of the model document; it is skipped when the model already exists.
     */
    public static TxnOp createOp(String uuid, String name) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(UUID, uuid);
        doc.put(NAME, name);
        doc.put(LifeAsserts.LIFE, Life.ALIVE);
        return TxnOp.on(CollectionNames.MODEL, StateContext.MODEL_ID)
                .assertThat(Condition.docMissing())
                .insert(doc);
    }

    public String getUUID() {
        return Documents.stringValue(doc, UUID);
    }

    public String getName() {
        return Documents.stringValue(doc, NAME);
    }

    public Life getLife() {
        return Life.valueOf(Documents.stringValue(doc, LifeAsserts.LIFE));
    }

    /**
     * Sets the model Dying. New machines, applications, units, relations and
     * offers are refused from then on.
     */
    public void destroy() {
        AtomicBoolean changed = new AtomicBoolean();
        ctx.runner().run("destroy model", attempt -> {
            changed.set(false);
            Map<String, Object> fresh = ctx.store().findOne(CollectionNames.MODEL, StateContext.MODEL_ID).orElse(null);
            if (fresh == null || !Life.ALIVE.name().equals(fresh.get(LifeAsserts.LIFE))) {
                return List.of();
            }
            changed.set(true);
            return List.of(TxnOp.on(CollectionNames.MODEL, StateContext.MODEL_ID)
                    .assertThat(LifeAsserts.isAlive())
                    .update(new Update().set(LifeAsserts.LIFE, Life.DYING)));
        });
        if (changed.get()) {
            ctx.metrics().recordLifeTransition("model", Life.DYING);
        }
        doc.put(LifeAsserts.LIFE, Life.DYING.name());
    }
}
