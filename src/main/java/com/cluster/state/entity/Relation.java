package com.cluster.state.entity;

import com.cluster.state.core.model.Endpoint;
import com.cluster.state.core.model.EndpointRole;
import com.cluster.state.core.model.Life;
import com.cluster.state.core.model.RelationScope;
import com.cluster.state.errors.AlreadyExistsException;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.errors.NotValidException;
import com.cluster.state.network.RelationNetworks;
import com.cluster.state.offer.OfferConnections;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * A relation between the endpoints of one or two applications.
 *
 * <p>A relation counts the units currently in its scope. Destroying a relation
 * nobody is in scope of removes it at once; otherwise it becomes Dying and is
 * removed when the last unit leaves scope.</p>
 */
public class Relation {

    private static final Logger log = LoggerFactory.getLogger(Relation.class);

    private final StateContext ctx;
    private RelationDoc doc;

    Relation(StateContext ctx, RelationDoc doc) {
        this.ctx = ctx;
        this.doc = doc;
    }

    /**
     * Ops destroying a relation, and whether they remove it outright.
     */
    record DestroyOps(List<TxnOp> ops, boolean removed) {
    }

    /**
     * Builds the canonical key of a relation between {@code endpoints}.
     */
    public static String keyOf(List<Endpoint> endpoints) {
        return endpoints.stream()
                .sorted(Comparator.comparing(Endpoint::toString))
                .map(Endpoint::toString)
                .collect(Collectors.joining(" "));
    }

    /**
     * Adds a relation between the given endpoints: one peer endpoint, or a
     * provider and a requirer sharing an interface.
     *
     * @throws AlreadyExistsException if the relation exists
     * @throws NotAliveException      if an application or the model is not alive
     */
    public static Relation add(StateContext ctx, Endpoint... endpoints) {
        List<Endpoint> eps = validate(Arrays.asList(endpoints));
        String key = keyOf(eps);
        Set<String> applications = new LinkedHashSet<>();
        eps.forEach(ep -> applications.add(ep.applicationName()));
        long id = ctx.sequences().next("relation");
        ctx.runner().run("add relation " + key, attempt -> {
            ctx.checkModelAlive();
            if (ctx.relationDoc(key).isPresent()) {
                throw new AlreadyExistsException("relation \"" + key + "\" already exists");
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(ctx.assertModelAliveOp());
            for (Endpoint ep : eps) {
                ApplicationDoc app = ctx.applicationDoc(ep.applicationName())
                        .orElseThrow(() -> new NotFoundException("application \"" + ep.applicationName() + "\" not found"));
                if (app.life() != Life.ALIVE) {
                    throw new NotAliveException("application \"" + app.name() + "\" is not alive");
                }
                boolean known = app.endpoints().stream().anyMatch(candidate ->
                        candidate.name().equals(ep.name()) && candidate.interfaceName().equals(ep.interfaceName()));
                if (!known) {
                    throw new NotValidException("application \"" + app.name() + "\" has no endpoint " + ep.name());
                }
            }
            for (String application : applications) {
                ops.add(TxnOp.on(CollectionNames.APPLICATIONS, application)
                        .assertThat(LifeAsserts.isAlive())
                        .update(new Update().inc(ApplicationDoc.RELATION_COUNT, 1)));
            }
            RelationDoc relation = new RelationDoc(key, id, eps, List.copyOf(applications), 0, Life.ALIVE, 0);
            ops.add(TxnOp.on(CollectionNames.RELATIONS, key)
                    .assertThat(Condition.docMissing())
                    .insert(ctx.codec().toDocument(relation)));
            return ops;
        });
        log.info("Relation {} added", key);
        return ctx.relation(key);
    }

    private static List<Endpoint> validate(List<Endpoint> endpoints) {
        if (endpoints.size() == 1) {
            if (endpoints.get(0).role() != EndpointRole.PEER) {
                throw new NotValidException("single endpoint " + endpoints.get(0) + " must be a peer relation");
            }
            return List.copyOf(endpoints);
        }
        if (endpoints.size() != 2) {
            throw new NotValidException("cannot relate " + endpoints.size() + " endpoints");
        }
        Endpoint first = endpoints.get(0);
        Endpoint second = endpoints.get(1);
        if (!first.canRelateTo(second)) {
            throw new NotValidException("endpoints " + first + " and " + second + " cannot be related");
        }
        if (first.scope() == RelationScope.CONTAINER || second.scope() == RelationScope.CONTAINER) {
            return endpoints.stream()
                    .map(ep -> new Endpoint(ep.applicationName(), ep.name(), ep.role(), ep.interfaceName(),
                            RelationScope.CONTAINER))
                    .toList();
        }
        return List.copyOf(endpoints);
    }

    // ========== Accessors ==========

    public String getKey() {
        return doc.key();
    }

    public long getId() {
        return doc.id();
    }

    public Life getLife() {
        return doc.life();
    }

    public List<Endpoint> getEndpoints() {
        return doc.endpoints();
    }

    /**
     * Number of units currently in scope.
     */
    public long getUnitCount() {
        return doc.unitCount();
    }

    /**
     * @throws NotFoundException if the application takes no part in the relation
     */
    public Endpoint endpoint(String applicationName) {
        return doc.endpoints().stream()
                .filter(ep -> ep.applicationName().equals(applicationName))
                .findFirst()
                .orElseThrow(() -> new NotFoundException(
                        "application \"" + applicationName + "\" is not a member of \"" + getKey() + "\""));
    }

    public RelationUnit unit(Unit unit) {
        endpoint(unit.getApplicationName());
        return new RelationUnit(ctx, this, unit);
    }

    public void refresh() {
        doc = ctx.relationDoc(getKey())
                .orElseThrow(() -> new NotFoundException("relation \"" + getKey() + "\" not found"));
    }

    // ========== Lifecycle ==========

    /**
     * Destroys the relation: removes it if no unit is in scope, otherwise sets it Dying.
     */
    public void destroy() {
        String key = getKey();
        AtomicReference<Life> outcome = new AtomicReference<>();
        ctx.runner().run("destroy relation " + key, attempt -> {
            outcome.set(null);
            RelationDoc fresh = ctx.relationDoc(key).orElse(null);
            if (fresh == null) {
                return List.of();
            }
            DestroyOps destroyOps = new Relation(ctx, fresh).destroyOps("");
            if (!destroyOps.ops().isEmpty()) {
                outcome.set(destroyOps.removed() ? Life.DEAD : Life.DYING);
            }
            return destroyOps.ops();
        });
        if (outcome.get() == Life.DEAD) {
            ctx.metrics().incrementRemoved("relation");
        } else if (outcome.get() == Life.DYING) {
            ctx.metrics().recordLifeTransition("relation", Life.DYING);
            doc = ctx.relationDoc(key).orElse(doc);
        }
    }

    /**
     * Ops destroying this relation as read. {@code ignoreApplication} names an
     * application whose relation count the caller adjusts itself.
     */
    DestroyOps destroyOps(String ignoreApplication) {
        if (doc.life() != Life.ALIVE) {
            return new DestroyOps(List.of(), false);
        }
        if (doc.unitCount() == 0) {
            return new DestroyOps(removeOps(ctx, doc, ignoreApplication,
                    Condition.and(LifeAsserts.isAlive(), Condition.eq(RelationDoc.UNIT_COUNT, 0L))), true);
        }
        return new DestroyOps(List.of(TxnOp.on(CollectionNames.RELATIONS, doc.key())
                .assertThat(Condition.and(LifeAsserts.isAlive(), Condition.gt(RelationDoc.UNIT_COUNT, 0)))
                .update(new Update().set(LifeAsserts.LIFE, Life.DYING))), false);
    }

    /**
     * Ops removing a relation, releasing its applications' relation counts and
     * dropping the records tied to it.
     */
    static List<TxnOp> removeOps(StateContext ctx, RelationDoc doc, String ignoreApplication, Condition asserts) {
        List<TxnOp> ops = new ArrayList<>();
        ops.add(TxnOp.on(CollectionNames.RELATIONS, doc.key())
                .assertThat(asserts)
                .remove());
        for (String application : new LinkedHashSet<>(doc.applications())) {
            if (!application.equals(ignoreApplication)) {
                ops.addAll(releaseRelationOps(ctx, application));
            }
        }
        ops.add(OfferConnections.removeOp(doc.id()));
        ops.addAll(RelationNetworks.removeOps(doc.key()));
        return ops;
    }

    private static List<TxnOp> releaseRelationOps(StateContext ctx, String applicationName) {
        ApplicationDoc app = ctx.applicationDoc(applicationName).orElse(null);
        if (app == null) {
            return List.of();
        }
        if (app.life() == Life.DYING && app.relationCount() == 1 && app.unitCount() == 0) {
            return Application.removeOps(ctx, app, Condition.and(
                    LifeAsserts.isDying(),
                    Condition.eq(ApplicationDoc.RELATION_COUNT, 1L),
                    Condition.eq(ApplicationDoc.UNIT_COUNT, 0L)));
        }
        Condition notLastRef = app.life() == Life.ALIVE
                ? Condition.and(LifeAsserts.isAlive(), Condition.gt(ApplicationDoc.RELATION_COUNT, 0))
                : Condition.and(Condition.gt(ApplicationDoc.RELATION_COUNT, 0), Condition.or(
                        Condition.gt(ApplicationDoc.UNIT_COUNT, 0),
                        Condition.gt(ApplicationDoc.RELATION_COUNT, 1)));
        return List.of(TxnOp.on(CollectionNames.APPLICATIONS, applicationName)
                .assertThat(notLastRef)
                .update(new Update().inc(ApplicationDoc.RELATION_COUNT, -1)));
    }

    @Override
    public String toString() {
        return "relation " + getKey();
    }
}
