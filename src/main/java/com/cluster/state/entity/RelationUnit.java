package com.cluster.state.entity;

import com.cluster.state.core.model.Life;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.settings.Settings;
import com.cluster.state.settings.SettingsCollection;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit's participation in a relation. Entering scope publishes the unit's
 * relation settings; leaving scope withdraws them.
 */
public class RelationUnit {

    private static final String RELATION_KEY = "relationkey";
    private static final String UNIT = "unit";

    private final StateContext ctx;
    private final Relation relation;
    private final Unit unit;

    RelationUnit(StateContext ctx, Relation relation, Unit unit) {
        this.ctx = ctx;
        this.relation = relation;
        this.unit = unit;
    }

    /**
     * Key of the scope document, which is also the key of the unit's relation settings.
     */
    static String scopeKey(long relationId, String unitName) {
        return "r#" + relationId + "#" + unitName;
    }

    static Condition scopesOfUnit(String unitName) {
        return Condition.eq(UNIT, unitName);
    }

    static String relationKeyOf(Map<String, Object> scopeDoc) {
        return String.valueOf(scopeDoc.get(RELATION_KEY));
    }

    public Relation getRelation() {
        return relation;
    }

    public Unit getUnit() {
        return unit;
    }

    /**
     * Enters the relation's scope with the given settings. Entering again is a no-op.
     *
     * @throws NotAliveException if the relation or the unit is no longer alive
     */
    public void enterScope(Map<String, ?> settings) {
        String key = relation.getKey();
        String unitName = unit.getName();
        String scopeKey = scopeKey(relation.getId(), unitName);
        ctx.runner().run("enter scope " + scopeKey, attempt -> {
            if (ctx.store().findOne(CollectionNames.RELATION_SCOPES, scopeKey).isPresent()) {
                return List.of();
            }
            RelationDoc rel = ctx.relationDoc(key).orElse(null);
            if (rel == null || rel.life() != Life.ALIVE) {
                throw new NotAliveException("relation \"" + key + "\" is no longer alive");
            }
            UnitDoc fresh = ctx.unitDoc(unitName).orElse(null);
            if (fresh == null || fresh.life() != Life.ALIVE) {
                throw new NotAliveException("unit \"" + unitName + "\" is no longer alive");
            }
            Map<String, Object> scope = new LinkedHashMap<>();
            scope.put(RELATION_KEY, key);
            scope.put(UNIT, unitName);
            List<TxnOp> ops = new ArrayList<>();
            ops.add(TxnOp.on(CollectionNames.RELATIONS, key)
                    .assertThat(LifeAsserts.isAlive())
                    .update(new Update().inc(RelationDoc.UNIT_COUNT, 1)));
            ops.add(TxnOp.on(CollectionNames.UNITS, unitName)
                    .assertThat(LifeAsserts.isAlive())
                    .check());
            ops.add(TxnOp.on(CollectionNames.RELATION_SCOPES, scopeKey)
                    .assertThat(Condition.docMissing())
                    .insert(scope));
            if (ctx.store().findOne(CollectionNames.SETTINGS, scopeKey).isPresent()) {
                ops.add(SettingsCollection.replaceOp(scopeKey, settings));
            } else {
                ops.add(SettingsCollection.createOp(scopeKey, settings));
            }
            return ops;
        });
    }

    /**
     * Leaves the relation's scope. The last unit leaving a Dying relation removes it.
     * Leaving when not in scope is a no-op.
     */
    public void leaveScope() {
        leaveScope(ctx, relation.getKey(), scopeKey(relation.getId(), unit.getName()));
    }

    static void leaveScope(StateContext ctx, String relationKey, String scopeKey) {
        ctx.runner().run("leave scope " + scopeKey, attempt -> {
            if (ctx.store().findOne(CollectionNames.RELATION_SCOPES, scopeKey).isEmpty()) {
                return List.of();
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(TxnOp.on(CollectionNames.RELATION_SCOPES, scopeKey)
                    .assertThat(Condition.docExists())
                    .remove());
            ops.add(SettingsCollection.removeOp(scopeKey));
            RelationDoc rel = ctx.relationDoc(relationKey).orElse(null);
            if (rel == null) {
                return ops;
            }
            if (rel.life() == Life.DYING && rel.unitCount() == 1) {
                ops.addAll(Relation.removeOps(ctx, rel, "",
                        Condition.and(LifeAsserts.isDying(), Condition.eq(RelationDoc.UNIT_COUNT, 1L))));
            } else {
                Condition asserts = rel.life() == Life.ALIVE
                        ? Condition.and(LifeAsserts.isAlive(), Condition.gt(RelationDoc.UNIT_COUNT, 0))
                        : Condition.gt(RelationDoc.UNIT_COUNT, 1);
                ops.add(TxnOp.on(CollectionNames.RELATIONS, relationKey)
                        .assertThat(asserts)
                        .update(new Update().inc(RelationDoc.UNIT_COUNT, -1)));
            }
            return ops;
        });
    }

    public boolean inScope() {
        return ctx.store().findOne(CollectionNames.RELATION_SCOPES, scopeKey(relation.getId(), unit.getName()))
                .isPresent();
    }

    /**
     * Returns this unit's relation settings.
     *
     * @throws NotFoundException if the unit never entered scope
     */
    public Settings settings() {
        return ctx.settings().read(scopeKey(relation.getId(), unit.getName()));
    }

    /**
     * Reads the relation settings of another unit in the relation.
     *
     * @throws NotFoundException if that unit has no settings in this relation
     */
    public Map<String, Object> readSettings(String unitName) {
        return ctx.settings().read(scopeKey(relation.getId(), unitName)).map();
    }
}
