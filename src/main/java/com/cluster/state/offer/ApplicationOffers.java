package com.cluster.state.offer;

import com.cluster.state.core.model.Life;
import com.cluster.state.entity.Application;
import com.cluster.state.entity.LifeAsserts;
import com.cluster.state.entity.Names;
import com.cluster.state.entity.Relation;
import com.cluster.state.entity.StateContext;
import com.cluster.state.errors.AlreadyExistsException;
import com.cluster.state.errors.HasDependentsException;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.errors.NotValidException;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;
import com.cluster.state.txn.RefCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Directory of application offers. Each offer holds one reference on its
 * application, which keeps the application from being destroyed.
 */
public class ApplicationOffers {

    private static final Logger log = LoggerFactory.getLogger(ApplicationOffers.class);

    private final StateContext ctx;
    private final OfferConnections connections;

    public ApplicationOffers(StateContext ctx) {
        this.ctx = ctx;
        this.connections = new OfferConnections(ctx);
    }

    // ========== Queries ==========

    /**
     * @throws NotFoundException if no offer has that name
     */
    public ApplicationOffer applicationOffer(String offerName) {
        return offerDoc(offerName)
                .map(OfferDoc::toOffer)
                .orElseThrow(() -> new NotFoundException("application offer \"" + offerName + "\" not found"));
    }

    /**
     * @throws NotFoundException if no offer has that UUID
     */
    public ApplicationOffer applicationOfferForUUID(String offerUUID) {
        return ctx.store().findMany(CollectionNames.APPLICATION_OFFERS,
                        Condition.eq(OfferDoc.OFFER_UUID, offerUUID)).stream()
                .findFirst()
                .map(d -> ctx.codec().fromDocument(d, OfferDoc.class).toOffer())
                .orElseThrow(() -> new NotFoundException("application offer " + offerUUID + " not found"));
    }

    public List<ApplicationOffer> allApplicationOffers() {
        return ctx.store().findAll(CollectionNames.APPLICATION_OFFERS).stream()
                .map(d -> ctx.codec().fromDocument(d, OfferDoc.class).toOffer())
                .toList();
    }

    /**
     * Returns the offers matching any of {@code filters}, or every offer when
     * none are given, ordered by offer name.
     */
    public List<ApplicationOffer> listOffers(OfferFilter... filters) {
        List<ApplicationOffer> all = allApplicationOffers();
        if (filters.length == 0) {
            return all;
        }
        Set<ApplicationOffer> matched = new LinkedHashSet<>();
        for (OfferFilter filter : filters) {
            all.stream().filter(filter::matches).forEach(matched::add);
        }
        return matched.stream()
                .sorted(Comparator.comparing(ApplicationOffer::offerName))
                .toList();
    }

    // ========== Mutations ==========

    /**
     * Publishes an offer.
     *
     * @throws AlreadyExistsException if an offer with that name exists
     * @throws NotAliveException      if the model is no longer alive
     */
    public ApplicationOffer addOffer(AddApplicationOfferArgs args) {
        validate(args);
        ctx.checkModelAlive();
        OfferDoc doc = newDoc(UUID.randomUUID().toString(), args);
        String offerName = args.getOfferName();
        String appName = args.getApplicationName();
        ctx.runner().run("add application offer " + offerName, attempt -> {
            if (attempt > 0) {
                ctx.checkModelAlive();
            }
            if (offerDoc(offerName).isPresent()) {
                throw new AlreadyExistsException("application offer \"" + offerName + "\" already exists");
            }
            aliveApplication(appName);
            return List.of(
                    ctx.assertModelAliveOp(),
                    TxnOp.on(CollectionNames.APPLICATIONS, appName).assertThat(LifeAsserts.isAlive()).check(),
                    TxnOp.on(CollectionNames.APPLICATION_OFFERS, offerName)
                            .assertThat(Condition.docMissing())
                            .insert(ctx.codec().toDocument(doc)),
                    ctx.refCounts().createOrIncRefOp(Application.offerRefKey(appName)));
        });
        log.info("Application offer {} added for application {}", offerName, appName);
        return doc.toOffer();
    }

    /**
     * Replaces an existing offer, keeping its UUID.
     *
     * @throws NotFoundException      if the offer does not exist
     * @throws HasDependentsException if removed endpoints are in use by consumers
     */
    public ApplicationOffer updateOffer(AddApplicationOfferArgs args) {
        validate(args);
        ctx.checkModelAlive();
        String offerName = args.getOfferName();
        AtomicReference<OfferDoc> updated = new AtomicReference<>();
        ctx.runner().run("update application offer " + offerName, attempt -> {
            if (attempt > 0) {
                ctx.checkModelAlive();
            }
            OfferDoc current = offerDoc(offerName)
                    .orElseThrow(() -> new NotFoundException("application offer \"" + offerName + "\" not found"));
            OfferDoc doc = newDoc(current.offerUUID(), args);
            updated.set(doc);
            List<TxnOp> ops = new ArrayList<>();
            if (!args.getApplicationName().equals(current.applicationName())) {
                aliveApplication(args.getApplicationName());
                ops.add(TxnOp.on(CollectionNames.APPLICATIONS, args.getApplicationName())
                        .assertThat(LifeAsserts.isAlive())
                        .check());
                ops.add(ctx.refCounts().createOrIncRefOp(Application.offerRefKey(args.getApplicationName())));
                ops.addAll(ctx.refCounts().decRefOps(Application.offerRefKey(current.applicationName())).ops());
            } else {
                Set<String> gone = new HashSet<>(current.endpoints().values());
                gone.removeAll(args.getEndpoints().values());
                ensureEndpointsNotInUse(current, gone);
            }
            ops.add(ctx.assertModelAliveOp());
            ops.add(TxnOp.on(CollectionNames.APPLICATION_OFFERS, offerName)
                    .assertThat(Condition.revno(current.revno()))
                    .update(new Update()
                            .set(OfferDoc.APPLICATION_NAME, doc.applicationName())
                            .set(OfferDoc.APPLICATION_DESCRIPTION, doc.applicationDescription())
                            .set(OfferDoc.ENDPOINTS, doc.endpoints())));
            return ops;
        });
        log.info("Application offer {} updated", offerName);
        return updated.get().toOffer();
    }

    /**
     * Removes an offer. Removing an offer that does not exist is a no-op.
     *
     * @param force also destroy the relations of consumers still connected
     * @throws HasDependentsException if consumers are connected and {@code force} is false
     */
    public void remove(String offerName, boolean force) {
        Optional<OfferDoc> existing = offerDoc(offerName);
        if (existing.isEmpty()) {
            return;
        }
        if (force) {
            for (OfferConnection conn : connections.offerConnections(existing.get().offerUUID())) {
                destroyRelation(conn.relationKey());
            }
        }
        AtomicBoolean removed = new AtomicBoolean();
        ctx.runner().run("remove application offer " + offerName, attempt -> {
            removed.set(false);
            OfferDoc current = offerDoc(offerName).orElse(null);
            if (current == null) {
                return List.of();
            }
            List<OfferConnection> conns = connections.offerConnections(current.offerUUID());
            if (!conns.isEmpty() && !force) {
                throw new HasDependentsException("cannot delete application offer \"" + offerName
                        + "\": offer has " + conns.size() + " relation" + (conns.size() == 1 ? "" : "s"));
            }
            List<TxnOp> ops = new ArrayList<>();
            ctx.store().findOne(CollectionNames.APPLICATIONS, current.applicationName()).ifPresent(app ->
                    ops.add(Application.relationCountUnchangedOp(current.applicationName(), app)));
            for (OfferConnection conn : conns) {
                ops.add(OfferConnections.removeOp(conn.relationId()));
            }
            ops.add(TxnOp.on(CollectionNames.APPLICATION_OFFERS, offerName)
                    .assertThat(Condition.docExists())
                    .remove());
            RefCounts.DecRef decRef = ctx.refCounts().decRefOps(Application.offerRefKey(current.applicationName()));
            ops.addAll(decRef.ops());
            removed.set(true);
            return ops;
        });
        if (removed.get()) {
            log.info("Application offer {} removed", offerName);
        }
    }

    // ========== Helpers ==========

    private void destroyRelation(String relationKey) {
        try {
            Relation relation = ctx.relation(relationKey);
            relation.destroy();
        } catch (NotFoundException e) {
            log.debug("Relation {} already gone", relationKey);
        }
    }

    private void ensureEndpointsNotInUse(OfferDoc offer, Set<String> endpoints) {
        if (endpoints.isEmpty()) {
            return;
        }
        Set<String> inUse = new TreeSet<>();
        for (OfferConnection conn : connections.offerConnections(offer.offerUUID())) {
            for (String part : conn.relationKey().split(" ")) {
                String[] tokens = part.split(":");
                if (tokens.length != 2) {
                    throw new NotValidException("malformed relation key \"" + conn.relationKey() + "\"");
                }
                if (tokens[0].equals(offer.applicationName()) && endpoints.contains(tokens[1])) {
                    inUse.add(tokens[1]);
                }
            }
        }
        if (inUse.size() == 1) {
            throw new HasDependentsException(
                    "application endpoint \"" + inUse.iterator().next() + "\" has active consumers");
        }
        if (inUse.size() > 1) {
            throw new HasDependentsException(
                    "application endpoints \"" + String.join(", ", inUse) + "\" have active consumers");
        }
    }

    private void validate(AddApplicationOfferArgs args) {
        if (!Names.isValidApplication(args.getOfferName())) {
            throw new NotValidException("offer name \"" + args.getOfferName() + "\" not valid");
        }
        Application app = ctx.application(args.getApplicationName());
        for (String endpointName : args.getEndpoints().values()) {
            app.endpoint(endpointName);
        }
    }

    private void aliveApplication(String name) {
        Application app = ctx.application(name);
        if (app.getLife() != Life.ALIVE) {
            throw new NotAliveException("application \"" + name + "\" is not alive");
        }
    }

    private Optional<OfferDoc> offerDoc(String offerName) {
        return ctx.store().findOne(CollectionNames.APPLICATION_OFFERS, offerName)
                .map(d -> ctx.codec().fromDocument(d, OfferDoc.class));
    }

    private static OfferDoc newDoc(String uuid, AddApplicationOfferArgs args) {
        return new OfferDoc(args.getOfferName(), uuid, args.getApplicationName(),
                args.getApplicationDescription(), args.getEndpoints(), 0);
    }
}
