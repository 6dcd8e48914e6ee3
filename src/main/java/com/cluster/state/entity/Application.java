package com.cluster.state.entity;

import com.cluster.state.cleanup.CleanupKind;
import com.cluster.state.cleanup.Cleanups;
import com.cluster.state.core.model.AgentStatus;
import com.cluster.state.core.model.Constraints;
import com.cluster.state.core.model.Endpoint;
import com.cluster.state.core.model.Life;
import com.cluster.state.errors.AlreadyExistsException;
import com.cluster.state.errors.HasDependentsException;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.errors.NotValidException;
import com.cluster.state.settings.ItemChange;
import com.cluster.state.settings.Settings;
import com.cluster.state.settings.SettingsCollection;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;
import com.cluster.state.txn.RefCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An application: a named set of units running the same charm.
 *
 * <p>An application keeps counts of its units and relations. Once Dying, it is
 * removed by whichever transaction drops the last of them.</p>
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    private final StateContext ctx;
    private ApplicationDoc doc;

    Application(StateContext ctx, ApplicationDoc doc) {
        this.ctx = ctx;
        this.doc = doc;
    }

    /**
     * Adds a new application along with its charm settings.
     *
     * @throws NotValidException      if the name or endpoints are invalid
     * @throws AlreadyExistsException if an application with this name exists
     * @throws NotAliveException      if the model is not alive
     */
    public static Application add(StateContext ctx, AddApplicationArgs args) {
        String name = args.getName();
        if (!Names.isValidApplication(name)) {
            throw new NotValidException("invalid application name \"" + name + "\"");
        }
        for (Endpoint endpoint : args.getEndpoints()) {
            if (!endpoint.applicationName().equals(name)) {
                throw new NotValidException("endpoint " + endpoint + " does not belong to application " + name);
            }
        }
        ApplicationDoc doc = new ApplicationDoc(name, args.getSeries(), args.isSubordinate(), args.getCharmUrl(),
                args.getEndpoints(), args.getConstraints(), args.isStorageRequiresProvisioning(),
                0, 0, Life.ALIVE, 0);
        ctx.runner().run("add application " + name, attempt -> {
            ctx.checkModelAlive();
            if (ctx.applicationDoc(name).isPresent()) {
                throw new AlreadyExistsException("application \"" + name + "\" already exists");
            }
            String settingsKey = settingsKey(name, args.getCharmUrl());
            return List.of(
                    ctx.assertModelAliveOp(),
                    TxnOp.on(CollectionNames.APPLICATIONS, name)
                            .assertThat(Condition.docMissing())
                            .insert(ctx.codec().toDocument(doc)),
                    SettingsCollection.createOp(settingsKey, args.getSettings()),
                    ctx.refCounts().createOrIncRefOp(settingsRefKey(name, args.getCharmUrl())));
        });
        log.info("Application {} added with charm {}", name, args.getCharmUrl());
        return ctx.application(name);
    }

    // ========== Keys ==========

    /**
     * Key of the settings document holding an application's config for one charm.
     */
    public static String settingsKey(String applicationName, String charmUrl) {
        return "a#" + applicationName + "#" + charmUrl;
    }

    static String settingsRefKey(String applicationName, String charmUrl) {
        return "settings#" + settingsKey(applicationName, charmUrl);
    }

    /**
     * Key of the counter of offers referencing an application.
     */
    public static String offerRefKey(String applicationName) {
        return "offers#" + applicationName;
    }

    /**
     * Asserts the application's relation count still matches the one in {@code appDoc}.
     */
    public static TxnOp relationCountUnchangedOp(String applicationName, Map<String, Object> appDoc) {
        return TxnOp.on(CollectionNames.APPLICATIONS, applicationName)
                .assertThat(Condition.eq(ApplicationDoc.RELATION_COUNT, appDoc.get(ApplicationDoc.RELATION_COUNT)))
                .check();
    }

    // ========== Accessors ==========

    public String getName() {
        return doc.name();
    }

    public String getSeries() {
        return doc.series();
    }

    public boolean isSubordinate() {
        return doc.subordinate();
    }

    public String getCharmURL() {
        return doc.charmUrl();
    }

    public Life getLife() {
        return doc.life();
    }

    public List<Endpoint> getEndpoints() {
        return doc.endpoints();
    }

    public Constraints getConstraints() {
        return doc.constraints();
    }

    public long getUnitCount() {
        return doc.unitCount();
    }

    public long getRelationCount() {
        return doc.relationCount();
    }

    /**
     * @throws NotFoundException if the application has no endpoint with that name
     */
    public Endpoint endpoint(String endpointName) {
        return doc.endpoints().stream()
                .filter(ep -> ep.name().equals(endpointName))
                .findFirst()
                .orElseThrow(() -> new NotFoundException(
                        "application \"" + getName() + "\" has no \"" + endpointName + "\" endpoint"));
    }

    public List<Unit> allUnits() {
        return ctx.units(getName());
    }

    public List<Relation> relations() {
        return ctx.relationsOf(getName());
    }

    /**
     * Reloads the application.
     *
     * @throws NotFoundException if it has been removed
     */
    public void refresh() {
        doc = ctx.applicationDoc(getName())
                .orElseThrow(() -> new NotFoundException("application \"" + getName() + "\" not found"));
    }

    // ========== Config ==========

    public Settings configSettings() {
        return ctx.settings().read(settingsKey(getName(), getCharmURL()));
    }

    /**
     * Applies {@code changes} to the application's config; a {@code null} value deletes the key.
     */
    public List<ItemChange> updateConfigSettings(Map<String, Object> changes) {
        Settings settings = configSettings();
        changes.forEach((key, value) -> {
            if (value == null) {
                settings.delete(key);
            } else {
                settings.set(key, value);
            }
        });
        return settings.write();
    }

    /**
     * Moves the application to another charm. The config of the old charm is
     * copied to the new one when the new one has none yet.
     */
    public void setCharm(String charmUrl) {
        String name = getName();
        ctx.runner().run("set charm of application " + name, attempt -> {
            ApplicationDoc fresh = ctx.applicationDoc(name)
                    .orElseThrow(() -> new NotFoundException("application \"" + name + "\" not found"));
            if (fresh.life() != Life.ALIVE) {
                throw new NotAliveException("application \"" + name + "\" is not alive");
            }
            if (fresh.charmUrl().equals(charmUrl)) {
                return List.of();
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(TxnOp.on(CollectionNames.APPLICATIONS, name)
                    .assertThat(Condition.and(LifeAsserts.isAlive(), Condition.eq(ApplicationDoc.CHARM_URL, fresh.charmUrl())))
                    .update(new Update().set(ApplicationDoc.CHARM_URL, charmUrl)));
            String newKey = settingsKey(name, charmUrl);
            if (ctx.store().findOne(CollectionNames.SETTINGS, newKey).isEmpty()) {
                Map<String, Object> current = ctx.settings().read(settingsKey(name, fresh.charmUrl())).map();
                ops.add(SettingsCollection.createOp(newKey, current));
            }
            ops.add(ctx.refCounts().createOrIncRefOp(settingsRefKey(name, charmUrl)));
            ops.addAll(releaseSettingsRefOps(ctx, name, fresh.charmUrl()));
            return ops;
        });
        refresh();
    }

    // ========== Units ==========

    /**
     * Adds a principal unit.
     *
     * @throws NotValidException if the application is a subordinate
     * @throws NotAliveException if the application or the model is not alive
     */
    public Unit addUnit() {
        if (isSubordinate()) {
            throw new NotValidException("cannot directly add units to subordinate application \"" + getName() + "\"");
        }
        String name = getName();
        String unitName = name + "/" + ctx.sequences().next("application-" + name);
        ctx.runner().run("add unit " + unitName, attempt -> {
            ctx.checkModelAlive();
            ApplicationDoc fresh = aliveApplication(name);
            UnitDoc unit = new UnitDoc(unitName, name, fresh.series(), "", List.of(), "", "", Life.ALIVE, 0);
            return List.of(
                    ctx.assertModelAliveOp(),
                    TxnOp.on(CollectionNames.APPLICATIONS, name)
                            .assertThat(LifeAsserts.isAlive())
                            .update(new Update().inc(ApplicationDoc.UNIT_COUNT, 1)),
                    TxnOp.on(CollectionNames.UNITS, unitName)
                            .assertThat(Condition.docMissing())
                            .insert(ctx.codec().toDocument(unit)),
                    StatusDocs.insertOp(StatusDocs.unitKey(unitName), AgentStatus.ALLOCATING));
        });
        log.debug("Unit {} added", unitName);
        return ctx.unit(unitName);
    }

    /**
     * Adds a subordinate unit of this application to {@code principal}.
     * A principal carries at most one subordinate per application.
     *
     * @throws AlreadyExistsException if the principal already has a unit of this application
     */
    public Unit addSubordinateUnit(Unit principal) {
        if (!isSubordinate()) {
            throw new NotValidException("application \"" + getName() + "\" is not a subordinate");
        }
        String name = getName();
        String principalName = principal.getName();
        String unitName = name + "/" + ctx.sequences().next("application-" + name);
        ctx.runner().run("add subordinate " + unitName, attempt -> {
            ctx.checkModelAlive();
            aliveApplication(name);
            UnitDoc host = ctx.unitDoc(principalName)
                    .orElseThrow(() -> new NotFoundException("unit \"" + principalName + "\" not found"));
            if (host.life() != Life.ALIVE) {
                throw new NotAliveException("unit \"" + principalName + "\" is not alive");
            }
            if (!host.isPrincipal()) {
                throw new NotValidException("unit \"" + principalName + "\" is a subordinate");
            }
            if (host.subordinates().stream().anyMatch(s -> s.startsWith(name + "/"))) {
                throw new AlreadyExistsException(
                        "unit \"" + principalName + "\" already has a subordinate of application \"" + name + "\"");
            }
            UnitDoc unit = new UnitDoc(unitName, name, host.series(), principalName, List.of(), "", "", Life.ALIVE, 0);
            return List.of(
                    ctx.assertModelAliveOp(),
                    TxnOp.on(CollectionNames.APPLICATIONS, name)
                            .assertThat(LifeAsserts.isAlive())
                            .update(new Update().inc(ApplicationDoc.UNIT_COUNT, 1)),
                    TxnOp.on(CollectionNames.UNITS, principalName)
                            .assertThat(Condition.and(LifeAsserts.isAlive(),
                                    Condition.noElementStartsWith(UnitDoc.SUBORDINATES, name + "/")))
                            .update(new Update().addToSet(UnitDoc.SUBORDINATES, unitName)),
                    TxnOp.on(CollectionNames.UNITS, unitName)
                            .assertThat(Condition.docMissing())
                            .insert(ctx.codec().toDocument(unit)),
                    StatusDocs.insertOp(StatusDocs.unitKey(unitName), AgentStatus.ALLOCATING));
        });
        return ctx.unit(unitName);
    }

    private ApplicationDoc aliveApplication(String name) {
        ApplicationDoc fresh = ctx.applicationDoc(name)
                .orElseThrow(() -> new NotFoundException("application \"" + name + "\" not found"));
        if (fresh.life() != Life.ALIVE) {
            throw new NotAliveException("application \"" + name + "\" is not alive");
        }
        return fresh;
    }

    // ========== Lifecycle ==========

    /**
     * Destroys the application. Relations nobody is in scope of are removed at
     * once. The application itself is removed when it has no units and no
     * remaining relations; otherwise it becomes Dying and a cleanup destroys
     * its units.
     *
     * @throws HasDependentsException if offers still reference the application
     */
    public void destroy() {
        String name = getName();
        AtomicReference<Life> outcome = new AtomicReference<>();
        ctx.runner().run("destroy application " + name, attempt -> {
            outcome.set(null);
            ApplicationDoc fresh = ctx.applicationDoc(name).orElse(null);
            if (fresh == null || fresh.life() != Life.ALIVE) {
                return List.of();
            }
            long offers = ctx.refCounts().read(offerRefKey(name));
            if (offers > 0) {
                throw new HasDependentsException("application \"" + name + "\" has " + offers + " offer(s)");
            }
            List<TxnOp> ops = new ArrayList<>();
            long removeCount = 0;
            for (Relation relation : ctx.relationsOf(name)) {
                Relation.DestroyOps destroyOps = relation.destroyOps(name);
                if (destroyOps.removed()) {
                    removeCount++;
                }
                ops.addAll(destroyOps.ops());
            }
            if (fresh.unitCount() == 0 && fresh.relationCount() == removeCount) {
                ops.addAll(removeOps(ctx, fresh, Condition.and(
                        LifeAsserts.isAlive(),
                        Condition.eq(ApplicationDoc.UNIT_COUNT, 0L),
                        Condition.eq(ApplicationDoc.RELATION_COUNT, fresh.relationCount()))));
                outcome.set(Life.DEAD);
                return ops;
            }
            Condition unitTerm = fresh.unitCount() == 0
                    ? Condition.eq(ApplicationDoc.UNIT_COUNT, 0L)
                    : Condition.gt(ApplicationDoc.UNIT_COUNT, 0);
            Update update = new Update().set(LifeAsserts.LIFE, Life.DYING);
            if (removeCount > 0) {
                update.inc(ApplicationDoc.RELATION_COUNT, -removeCount);
            }
            ops.add(TxnOp.on(CollectionNames.APPLICATIONS, name)
                    .assertThat(Condition.and(LifeAsserts.isAlive(),
                            Condition.eq(ApplicationDoc.RELATION_COUNT, fresh.relationCount()), unitTerm))
                    .update(update));
            ops.add(ctx.refCounts().assertCountOp(offerRefKey(name), 0));
            if (fresh.unitCount() > 0) {
                ops.add(Cleanups.newCleanupOp(CleanupKind.UNITS_FOR_DYING_APPLICATION, name));
            }
            outcome.set(Life.DYING);
            return ops;
        });
        if (outcome.get() == Life.DEAD) {
            log.info("Application {} removed", name);
            ctx.metrics().incrementRemoved("application");
        } else if (outcome.get() == Life.DYING) {
            log.info("Application {} is dying", name);
            ctx.metrics().recordLifeTransition("application", Life.DYING);
        }
    }

    /**
     * Ops removing an application whose last reference is going away.
     * Callers supply the assertions proving it is the last reference.
     */
    static List<TxnOp> removeOps(StateContext ctx, ApplicationDoc doc, Condition asserts) {
        return removeOps(ctx, doc, asserts, 1);
    }

    /**
     * As {@link #removeOps(StateContext, ApplicationDoc, Condition)}, also releasing
     * references to the charm settings held by others leaving in the same batch.
     */
    static List<TxnOp> removeOps(StateContext ctx, ApplicationDoc doc, Condition asserts, long settingsRefs) {
        List<TxnOp> ops = new ArrayList<>();
        ops.add(TxnOp.on(CollectionNames.APPLICATIONS, doc.name())
                .assertThat(asserts)
                .remove());
        ops.addAll(releaseSettingsRefOps(ctx, doc.name(), doc.charmUrl(), settingsRefs));
        ops.add(ctx.refCounts().assertCountOp(offerRefKey(doc.name()), 0));
        ops.add(ctx.refCounts().removeOp(offerRefKey(doc.name())));
        return ops;
    }

    /**
     * Ops dropping one reference to an application's charm settings, removing
     * the settings with the last reference.
     */
    static List<TxnOp> releaseSettingsRefOps(StateContext ctx, String applicationName, String charmUrl) {
        return releaseSettingsRefOps(ctx, applicationName, charmUrl, 1);
    }

    private static List<TxnOp> releaseSettingsRefOps(StateContext ctx, String applicationName, String charmUrl,
                                                     long refs) {
        RefCounts.DecRef decRef = ctx.refCounts().decRefOps(settingsRefKey(applicationName, charmUrl), refs);
        List<TxnOp> ops = new ArrayList<>(decRef.ops());
        if (decRef.lastRef()) {
            ops.add(SettingsCollection.removeOp(settingsKey(applicationName, charmUrl)));
        }
        return ops;
    }

    @Override
    public String toString() {
        return "application " + getName();
    }
}
