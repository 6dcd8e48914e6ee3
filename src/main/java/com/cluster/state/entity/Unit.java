package com.cluster.state.entity;

import com.cluster.state.cleanup.CleanupKind;
import com.cluster.state.cleanup.Cleanups;
import com.cluster.state.core.model.AgentStatus;
import com.cluster.state.core.model.ContainerType;
import com.cluster.state.core.model.Life;
import com.cluster.state.core.model.MachineJob;
import com.cluster.state.errors.AlreadyAssignedException;
import com.cluster.state.errors.HasSubordinatesException;
import com.cluster.state.errors.MachineInUseException;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotAssignedException;
import com.cluster.state.errors.NotDeadException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.errors.PolicyViolationException;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.Documents;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A unit of an application. Principal units are assigned to machines;
 * subordinate units live alongside a principal.
 */
public class Unit {

    private static final Logger log = LoggerFactory.getLogger(Unit.class);

    private final StateContext ctx;
    private UnitDoc doc;

    Unit(StateContext ctx, UnitDoc doc) {
        this.ctx = ctx;
        this.doc = doc;
    }

    // ========== Accessors ==========

    public String getName() {
        return doc.name();
    }

    public String getApplicationName() {
        return doc.application();
    }

    public String getSeries() {
        return doc.series();
    }

    public Life getLife() {
        return doc.life();
    }

    public boolean isPrincipal() {
        return doc.isPrincipal();
    }

    /**
     * Name of the principal unit, or empty for a principal.
     */
    public String getPrincipalName() {
        return doc.principal();
    }

    public List<String> getSubordinateNames() {
        return doc.subordinates();
    }

    public String getCharmURL() {
        return doc.charmUrl();
    }

    public Application application() {
        return ctx.application(getApplicationName());
    }

    /**
     * Returns the id of the machine the unit runs on; a subordinate runs on its principal's machine.
     *
     * @throws NotAssignedException if no machine is assigned
     */
    public String assignedMachineId() {
        if (!isPrincipal()) {
            return ctx.unit(getPrincipalName()).assignedMachineId();
        }
        if (doc.machineId().isEmpty()) {
            throw new NotAssignedException("unit \"" + getName() + "\" is not assigned to a machine");
        }
        return doc.machineId();
    }

    /**
     * Reloads the unit.
     *
     * @throws NotFoundException if it has been removed
     */
    public void refresh() {
        doc = ctx.unitDoc(getName())
                .orElseThrow(() -> new NotFoundException("unit \"" + getName() + "\" not found"));
    }

    // ========== Status and charm ==========

    public AgentStatus agentStatus() {
        Map<String, Object> status = ctx.store().findOne(CollectionNames.STATUSES, StatusDocs.unitKey(getName()))
                .orElseThrow(() -> new NotFoundException("status of unit \"" + getName() + "\" not found"));
        return AgentStatus.valueOf(Documents.stringValue(status, StatusDocs.STATUS));
    }

    public void setAgentStatus(AgentStatus status, String info) {
        String name = getName();
        ctx.runner().run("set status of unit " + name, attempt -> {
            UnitDoc fresh = ctx.unitDoc(name)
                    .orElseThrow(() -> new NotFoundException("unit \"" + name + "\" not found"));
            if (fresh.life() == Life.DEAD) {
                throw new NotAliveException("unit \"" + name + "\" is dead");
            }
            return List.of(
                    TxnOp.on(CollectionNames.UNITS, name).assertThat(LifeAsserts.notDead()).check(),
                    StatusDocs.setOp(StatusDocs.unitKey(name), status, info));
        });
    }

    /**
     * Records the charm the unit runs, moving its reference to the charm's settings.
     *
     * @throws NotFoundException if the application does not use that charm
     */
    public void setCharmURL(String charmUrl) {
        String name = getName();
        ctx.runner().run("set charm of unit " + name, attempt -> {
            UnitDoc fresh = ctx.unitDoc(name)
                    .orElseThrow(() -> new NotFoundException("unit \"" + name + "\" not found"));
            if (fresh.life() == Life.DEAD) {
                throw new NotAliveException("unit \"" + name + "\" is dead");
            }
            if (fresh.charmUrl().equals(charmUrl)) {
                return List.of();
            }
            String refKey = Application.settingsRefKey(fresh.application(), charmUrl);
            if (ctx.refCounts().read(refKey) == 0) {
                throw new NotFoundException("charm \"" + charmUrl + "\" is not in use by application \""
                        + fresh.application() + "\"");
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(TxnOp.on(CollectionNames.UNITS, name)
                    .assertThat(Condition.and(LifeAsserts.notDead(), Condition.eq(UnitDoc.CHARM_URL, fresh.charmUrl())))
                    .update(new Update().set(UnitDoc.CHARM_URL, charmUrl)));
            ops.add(ctx.refCounts().incRefOp(refKey));
            if (!fresh.charmUrl().isEmpty()) {
                ops.addAll(Application.releaseSettingsRefOps(ctx, fresh.application(), fresh.charmUrl()));
            }
            return ops;
        });
        refresh();
    }

    // ========== Lifecycle ==========

    /**
     * Destroys the unit. A principal without subordinates whose agent never
     * started is removed at once, subject to the configured removal policy;
     * any other Alive unit becomes Dying. Destroying a unit that is already
     * Dying, Dead or gone is a no-op.
     */
    public void destroy() {
        String name = getName();
        AtomicReference<Life> outcome = new AtomicReference<>();
        ctx.runner().run("destroy unit " + name, attempt -> {
            outcome.set(null);
            UnitDoc fresh = ctx.unitDoc(name).orElse(null);
            if (fresh == null || fresh.life() != Life.ALIVE) {
                return List.of();
            }
            List<TxnOp> setDying = List.of(
                    TxnOp.on(CollectionNames.UNITS, name)
                            .assertThat(LifeAsserts.isAlive())
                            .update(new Update().set(LifeAsserts.LIFE, Life.DYING)),
                    Cleanups.newCleanupOp(CleanupKind.DYING_UNIT, name));
            outcome.set(Life.DYING);
            if (!fresh.isPrincipal() || !fresh.subordinates().isEmpty()) {
                return setDying;
            }
            if (ctx.store().count(CollectionNames.RELATION_SCOPES, RelationUnit.scopesOfUnit(name)) > 0) {
                return setDying;
            }
            Map<String, Object> status = ctx.store().findOne(CollectionNames.STATUSES, StatusDocs.unitKey(name))
                    .orElse(null);
            Optional<Condition> statusAssert = ctx.removalPolicy().removalAssertion(name, status);
            if (statusAssert.isEmpty()) {
                return setDying;
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(TxnOp.on(CollectionNames.STATUSES, StatusDocs.unitKey(name))
                    .assertThat(statusAssert.get())
                    .check());
            ops.addAll(outOfScopeOps(fresh));
            ops.addAll(removeOps(fresh, Condition.and(LifeAsserts.isAlive(),
                    Condition.emptyOrMissing(UnitDoc.SUBORDINATES))));
            outcome.set(Life.DEAD);
            return ops;
        });
        if (outcome.get() == Life.DEAD) {
            log.info("Unit {} removed directly; its agent never started", name);
            ctx.metrics().incrementRemoved("unit");
        } else if (outcome.get() == Life.DYING) {
            log.debug("Unit {} is dying", name);
            ctx.metrics().recordLifeTransition("unit", Life.DYING);
        }
        ctx.unitDoc(name).ifPresent(fresh -> doc = fresh);
    }

    /**
     * Sets the unit Dead. Calling it on a Dead or removed unit is a no-op.
     *
     * @throws HasSubordinatesException while subordinate units remain
     */
    public void ensureDead() {
        String name = getName();
        AtomicReference<Life> outcome = new AtomicReference<>();
        ctx.runner().run("ensure dead unit " + name, attempt -> {
            outcome.set(null);
            UnitDoc fresh = ctx.unitDoc(name).orElse(null);
            if (fresh == null || fresh.life() == Life.DEAD) {
                return List.of();
            }
            if (!fresh.subordinates().isEmpty()) {
                throw new HasSubordinatesException("unit \"" + name + "\" still has subordinate units");
            }
            outcome.set(Life.DEAD);
            return List.of(TxnOp.on(CollectionNames.UNITS, name)
                    .assertThat(Condition.and(LifeAsserts.notDead(), Condition.emptyOrMissing(UnitDoc.SUBORDINATES)))
                    .update(new Update().set(LifeAsserts.LIFE, Life.DEAD)));
        });
        if (outcome.get() == Life.DEAD) {
            ctx.metrics().recordLifeTransition("unit", Life.DEAD);
        }
        ctx.unitDoc(name).ifPresent(fresh -> doc = fresh);
    }

    /**
     * Removes a Dead unit: leaves every relation scope, then deletes the unit
     * and releases everything it held. Removing a unit that is already gone is a no-op.
     *
     * @throws NotDeadException if the unit is not Dead
     */
    public void remove() {
        String name = getName();
        UnitDoc current = ctx.unitDoc(name).orElse(null);
        if (current == null) {
            return;
        }
        if (current.life() != Life.DEAD) {
            throw new NotDeadException("cannot remove unit \"" + name + "\": unit is not dead");
        }
        for (Map<String, Object> scope : ctx.store().findMany(CollectionNames.RELATION_SCOPES,
                RelationUnit.scopesOfUnit(name))) {
            RelationUnit.leaveScope(ctx, RelationUnit.relationKeyOf(scope), Documents.stringValue(scope, Documents.ID));
        }
        AtomicReference<Boolean> removed = new AtomicReference<>(false);
        ctx.runner().run("remove unit " + name, attempt -> {
            removed.set(false);
            UnitDoc fresh = ctx.unitDoc(name).orElse(null);
            if (fresh == null) {
                return List.of();
            }
            if (fresh.life() != Life.DEAD) {
                throw new NotDeadException("cannot remove unit \"" + name + "\": unit is not dead");
            }
            removed.set(true);
            return removeOps(fresh, LifeAsserts.isDead());
        });
        if (removed.get()) {
            log.info("Unit {} removed", name);
            ctx.metrics().incrementRemoved("unit");
        }
    }

    /**
     * Ops deleting the unit and releasing its machine, principal, application
     * count and charm settings reference.
     */
    /**
     * Asserts the unit is in no relation scope. The application's relation
     * count is read before its relations, so a relation added in between
     * aborts the batch.
     */
    private List<TxnOp> outOfScopeOps(UnitDoc unit) {
        List<TxnOp> ops = new ArrayList<>();
        ctx.applicationDoc(unit.application()).ifPresent(app ->
                ops.add(TxnOp.on(CollectionNames.APPLICATIONS, app.name())
                        .assertThat(Condition.eq(ApplicationDoc.RELATION_COUNT, app.relationCount()))
                        .check()));
        for (Relation relation : ctx.relationsOf(unit.application())) {
            ops.add(TxnOp.on(CollectionNames.RELATION_SCOPES, RelationUnit.scopeKey(relation.getId(), unit.name()))
                    .assertThat(Condition.docMissing())
                    .check());
        }
        return ops;
    }

    private List<TxnOp> removeOps(UnitDoc unit, Condition asserts) {
        List<TxnOp> ops = new ArrayList<>();
        ops.add(TxnOp.on(CollectionNames.UNITS, unit.name())
                .assertThat(Condition.and(asserts, Condition.eq(UnitDoc.MACHINE_ID, unit.machineId())))
                .remove());
        ops.add(StatusDocs.removeOp(StatusDocs.unitKey(unit.name())));
        if (!unit.isPrincipal()) {
            ops.add(TxnOp.on(CollectionNames.UNITS, unit.principal())
                    .update(new Update().pull(UnitDoc.SUBORDINATES, unit.name())));
        } else if (!unit.machineId().isEmpty()) {
            ops.addAll(hostOps(unit));
        }

        ApplicationDoc app = ctx.applicationDoc(unit.application()).orElse(null);
        boolean holdsCharmRef = !unit.charmUrl().isEmpty();
        if (app != null && app.life() == Life.DYING && app.unitCount() == 1 && app.relationCount() == 0) {
            boolean sameCharm = holdsCharmRef && unit.charmUrl().equals(app.charmUrl());
            ops.addAll(Application.removeOps(ctx, app, Condition.and(
                    LifeAsserts.isDying(),
                    Condition.eq(ApplicationDoc.UNIT_COUNT, 1L),
                    Condition.eq(ApplicationDoc.RELATION_COUNT, 0L)), sameCharm ? 2 : 1));
            if (holdsCharmRef && !sameCharm) {
                ops.addAll(Application.releaseSettingsRefOps(ctx, unit.application(), unit.charmUrl()));
            }
            return ops;
        }
        if (app != null) {
            Condition notLastRef = app.life() == Life.ALIVE
                    ? Condition.and(LifeAsserts.isAlive(), Condition.gt(ApplicationDoc.UNIT_COUNT, 0))
                    : Condition.and(Condition.gt(ApplicationDoc.UNIT_COUNT, 0), Condition.or(
                            Condition.gt(ApplicationDoc.UNIT_COUNT, 1),
                            Condition.gt(ApplicationDoc.RELATION_COUNT, 0)));
            ops.add(TxnOp.on(CollectionNames.APPLICATIONS, app.name())
                    .assertThat(notLastRef)
                    .update(new Update().inc(ApplicationDoc.UNIT_COUNT, -1)));
        }
        if (holdsCharmRef) {
            ops.addAll(Application.releaseSettingsRefOps(ctx, unit.application(), unit.charmUrl()));
        }
        return ops;
    }

    /**
     * Ops pulling the unit from its machine. When the unit is the machine's
     * only principal and nothing else keeps the machine busy, the machine is
     * set Dying in the same batch.
     */
    private List<TxnOp> hostOps(UnitDoc unit) {
        MachineDoc machine = ctx.machineDoc(unit.machineId()).orElse(null);
        if (machine == null) {
            return List.of();
        }
        Update pull = new Update().pull(MachineDoc.PRINCIPALS, unit.name());
        Condition standalone = Condition.and(
                LifeAsserts.isAlive(),
                Condition.listEquals(MachineDoc.PRINCIPALS, List.of(unit.name())),
                Condition.notContains(MachineDoc.JOBS, MachineJob.MANAGE_MODEL),
                Condition.eq(MachineDoc.HAS_VOTE, false));
        boolean machineFree = machine.life() == Life.ALIVE
                && machine.principals().equals(List.of(unit.name()))
                && !machine.hasJob(MachineJob.MANAGE_MODEL)
                && !machine.hasVote();
        if (!machineFree) {
            return List.of(TxnOp.on(CollectionNames.MACHINES, machine.id())
                    .assertThat(Condition.not(standalone))
                    .update(pull));
        }
        if (!Machine.containerChildren(ctx, machine.id()).isEmpty()) {
            return List.of(
                    TxnOp.on(CollectionNames.MACHINES, machine.id()).update(pull),
                    TxnOp.on(CollectionNames.CONTAINER_REFS, machine.id())
                            .assertThat(Condition.not(Condition.emptyOrMissing(Machine.CHILDREN)))
                            .check());
        }
        log.debug("Machine {} loses its last unit {} and will be set dying", machine.id(), unit.name());
        return List.of(
                TxnOp.on(CollectionNames.MACHINES, machine.id())
                        .assertThat(standalone)
                        .update(pull.set(LifeAsserts.LIFE, Life.DYING)),
                Machine.noContainersOp(machine.id()));
    }

    // ========== Assignment ==========

    /**
     * Assigns the unit to an existing machine. Assigning it again to the same machine is a no-op.
     *
     * @throws AlreadyAssignedException if the unit is on another machine
     * @throws NotAliveException        if the unit or the machine is not alive
     * @throws PolicyViolationException if a placement rule denies the unit on that machine
     */
    public void assignToMachine(Machine machine) {
        assignToMachine(machine.getId(), false, false);
    }

    private void assignToMachine(String machineId, boolean requireClean, boolean requireEmpty) {
        String name = getName();
        ctx.runner().run("assign unit " + name + " to machine " + machineId, attempt -> {
            UnitDoc unit = assignableUnit(name);
            if (unit.machineId().equals(machineId)) {
                return List.of();
            }
            if (!unit.machineId().isEmpty()) {
                throw new AlreadyAssignedException(
                        "unit \"" + name + "\" is already assigned to machine " + unit.machineId());
            }
            MachineDoc machine = ctx.machineDoc(machineId)
                    .orElseThrow(() -> new NotFoundException("machine " + machineId + " not found"));
            if (machine.life() != Life.ALIVE) {
                if (requireClean) {
                    throw new MachineInUseException("machine " + machineId + " is not alive");
                }
                throw new NotAliveException("machine " + machineId + " is not alive");
            }
            if (!machine.hasJob(MachineJob.HOST_UNITS)) {
                throw new PolicyViolationException("machine " + machineId + " cannot host units");
            }
            if (!machine.series().equals(unit.series())) {
                throw new PolicyViolationException("cannot assign unit \"" + name + "\" to machine " + machineId
                        + ": series does not match");
            }
            if (requireClean && !machine.clean()) {
                throw new MachineInUseException("machine " + machineId + " is not clean");
            }
            if (requireEmpty && !Machine.containerChildren(ctx, machineId).isEmpty()) {
                throw new MachineInUseException("machine " + machineId + " has containers");
            }
            List<Condition> machineAsserts = new ArrayList<>(List.of(
                    LifeAsserts.isAlive(), Condition.eq(MachineDoc.SERIES, unit.series())));
            if (requiresUnprovisionedMachine(unit)) {
                if (!machine.instanceId().isEmpty()) {
                    throw new PolicyViolationException("cannot assign unit \"" + name + "\" to provisioned machine "
                            + machineId + ": its storage must be attached at provisioning");
                }
                machineAsserts.add(Condition.eq(MachineDoc.INSTANCE_ID, ""));
            }
            if (requireClean) {
                machineAsserts.add(Condition.eq(MachineDoc.CLEAN, true));
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(assignUnitOp(name, machineId));
            ops.add(TxnOp.on(CollectionNames.MACHINES, machineId)
                    .assertThat(Condition.and(machineAsserts.toArray(new Condition[0])))
                    .update(new Update().addToSet(MachineDoc.PRINCIPALS, name).set(MachineDoc.CLEAN, false)));
            if (requireEmpty) {
                ops.add(Machine.noContainersOp(machineId));
            }
            return ops;
        });
        refresh();
    }

    /**
     * Assigns the unit to a newly created machine, or to a new container on a
     * new machine when the application is constrained to containers.
     */
    public Machine assignToNewMachine() {
        ContainerType container = application().getConstraints().container();
        if (container.isContainer()) {
            return assignToNewHostWithContainer(container);
        }
        String name = getName();
        String machineId = String.valueOf(ctx.sequences().next("machine"));
        ctx.runner().run("assign unit " + name + " to new machine " + machineId, attempt -> {
            ctx.checkModelAlive();
            UnitDoc unit = unassignedUnit(name);
            List<TxnOp> ops = new ArrayList<>();
            ops.add(ctx.assertModelAliveOp());
            ops.add(assignUnitOp(name, machineId));
            ops.addAll(Machine.insertOps(ctx, Machine.newDoc(machineId, unit.series(),
                    List.of(MachineJob.HOST_UNITS), List.of(name), ContainerType.NONE, ""), List.of()));
            return ops;
        });
        refresh();
        return ctx.machine(machineId);
    }

    /**
     * Assigns the unit to a new machine, honouring a container constraint by
     * creating the container on a clean, empty machine when one is available.
     */
    public Machine assignToNewMachineOrContainer() {
        ContainerType container = application().getConstraints().container();
        if (!container.isContainer()) {
            return assignToNewMachine();
        }
        Condition hosts = Condition.and(
                LifeAsserts.isAlive(),
                Condition.eq(MachineDoc.CLEAN, true),
                Condition.eq(MachineDoc.CONTAINER_TYPE, ContainerType.NONE),
                Condition.listEquals(MachineDoc.JOBS, List.of(MachineJob.HOST_UNITS)));
        for (Map<String, Object> host : ctx.store().findMany(CollectionNames.MACHINES, hosts)) {
            String hostId = Documents.stringValue(host, Documents.ID);
            if (!Machine.containerChildren(ctx, hostId).isEmpty()) {
                continue;
            }
            try {
                return assignToNewContainer(hostId, container);
            } catch (MachineInUseException e) {
                log.debug("Host {} no longer available for unit {}: {}", hostId, getName(), e.getMessage());
            }
        }
        return assignToNewHostWithContainer(container);
    }

    private Machine assignToNewContainer(String hostId, ContainerType type) {
        String name = getName();
        String containerId = Machine.newContainerId(ctx, hostId, type);
        ctx.runner().run("assign unit " + name + " to new container " + containerId, attempt -> {
            ctx.checkModelAlive();
            UnitDoc unit = unassignedUnit(name);
            MachineDoc host = ctx.machineDoc(hostId).orElse(null);
            if (host == null || host.life() != Life.ALIVE || !host.clean()) {
                throw new MachineInUseException("machine " + hostId + " is no longer a clean host");
            }
            if (!Machine.containerChildren(ctx, hostId).isEmpty()) {
                throw new MachineInUseException("machine " + hostId + " has containers");
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(ctx.assertModelAliveOp());
            ops.add(assignUnitOp(name, containerId));
            ops.add(TxnOp.on(CollectionNames.MACHINES, hostId)
                    .assertThat(Condition.and(LifeAsserts.isAlive(), Condition.eq(MachineDoc.CLEAN, true)))
                    .check());
            ops.add(TxnOp.on(CollectionNames.CONTAINER_REFS, hostId)
                    .assertThat(Condition.emptyOrMissing(Machine.CHILDREN))
                    .update(new Update().addToSet(Machine.CHILDREN, containerId)));
            ops.addAll(Machine.insertOps(ctx, Machine.newDoc(containerId, unit.series(),
                    List.of(MachineJob.HOST_UNITS), List.of(name), type, ""), List.of()));
            return ops;
        });
        refresh();
        return ctx.machine(containerId);
    }

    private Machine assignToNewHostWithContainer(ContainerType type) {
        String name = getName();
        String hostId = String.valueOf(ctx.sequences().next("machine"));
        String containerId = Machine.newContainerId(ctx, hostId, type);
        ctx.runner().run("assign unit " + name + " to new " + type.name().toLowerCase(Locale.ROOT)
                + " container " + containerId, attempt -> {
            ctx.checkModelAlive();
            UnitDoc unit = unassignedUnit(name);
            List<TxnOp> ops = new ArrayList<>();
            ops.add(ctx.assertModelAliveOp());
            ops.add(assignUnitOp(name, containerId));
            ops.addAll(Machine.insertOps(ctx, Machine.newDoc(hostId, unit.series(),
                    List.of(MachineJob.HOST_UNITS), List.of(), ContainerType.NONE, ""), List.of(containerId)));
            ops.addAll(Machine.insertOps(ctx, Machine.newDoc(containerId, unit.series(),
                    List.of(MachineJob.HOST_UNITS), List.of(name), type, ""), List.of()));
            return ops;
        });
        refresh();
        return ctx.machine(containerId);
    }

    /**
     * Assigns the unit to a machine that has never hosted a unit.
     *
     * @throws MachineInUseException if no such machine is left
     */
    public Machine assignToCleanMachine() {
        return assignToCleanMaybeEmptyMachine(false);
    }

    /**
     * Assigns the unit to a machine that has never hosted a unit and has no containers.
     *
     * @throws MachineInUseException if no such machine is left
     */
    public Machine assignToCleanEmptyMachine() {
        return assignToCleanMaybeEmptyMachine(true);
    }

    private Machine assignToCleanMaybeEmptyMachine(boolean requireEmpty) {
        UnitDoc unit = assignableUnit(getName());
        ContainerType container = application().getConstraints().container();
        Condition candidates = Condition.and(
                LifeAsserts.isAlive(),
                Condition.eq(MachineDoc.SERIES, unit.series()),
                Condition.listEquals(MachineDoc.JOBS, List.of(MachineJob.HOST_UNITS)),
                Condition.eq(MachineDoc.CLEAN, true),
                Condition.eq(MachineDoc.CONTAINER_TYPE, container));
        for (Map<String, Object> candidate : ctx.store().findMany(CollectionNames.MACHINES, candidates)) {
            String machineId = Documents.stringValue(candidate, Documents.ID);
            if (requireEmpty && !Machine.containerChildren(ctx, machineId).isEmpty()) {
                continue;
            }
            try {
                assignToMachine(machineId, true, requireEmpty);
                return ctx.machine(machineId);
            } catch (MachineInUseException e) {
                log.debug("Skipping machine {} for unit {}: {}", machineId, getName(), e.getMessage());
            }
        }
        throw new MachineInUseException("cannot assign unit \"" + getName() + "\" to clean"
                + (requireEmpty ? ", empty" : "") + " machine: all eligible machines in use");
    }

    /**
     * Releases the unit from its machine. The machine stays unclean.
     */
    public void unassignFromMachine() {
        String name = getName();
        ctx.runner().run("unassign unit " + name, attempt -> {
            UnitDoc fresh = ctx.unitDoc(name)
                    .orElseThrow(() -> new NotFoundException("unit \"" + name + "\" not found"));
            if (fresh.machineId().isEmpty()) {
                return List.of();
            }
            return List.of(
                    TxnOp.on(CollectionNames.UNITS, name)
                            .assertThat(Condition.eq(UnitDoc.MACHINE_ID, fresh.machineId()))
                            .update(new Update().set(UnitDoc.MACHINE_ID, "")),
                    TxnOp.on(CollectionNames.MACHINES, fresh.machineId())
                            .update(new Update().pull(MachineDoc.PRINCIPALS, name)));
        });
        refresh();
    }

    private UnitDoc assignableUnit(String name) {
        UnitDoc unit = ctx.unitDoc(name)
                .orElseThrow(() -> new NotFoundException("unit \"" + name + "\" not found"));
        if (unit.life() != Life.ALIVE) {
            throw new NotAliveException("unit \"" + name + "\" is not alive");
        }
        if (!unit.isPrincipal()) {
            throw new PolicyViolationException("unit \"" + name + "\" is a subordinate");
        }
        return unit;
    }

    private UnitDoc unassignedUnit(String name) {
        UnitDoc unit = assignableUnit(name);
        if (!unit.machineId().isEmpty()) {
            throw new AlreadyAssignedException(
                    "unit \"" + name + "\" is already assigned to machine " + unit.machineId());
        }
        return unit;
    }

    private boolean requiresUnprovisionedMachine(UnitDoc unit) {
        return ctx.applicationDoc(unit.application())
                .map(ApplicationDoc::storageRequiresProvisioning)
                .orElse(false);
    }

    private static TxnOp assignUnitOp(String unitName, String machineId) {
        return TxnOp.on(CollectionNames.UNITS, unitName)
                .assertThat(Condition.and(LifeAsserts.isAlive(), Condition.eq(UnitDoc.MACHINE_ID, "")))
                .update(new Update().set(UnitDoc.MACHINE_ID, machineId));
    }

    @Override
    public String toString() {
        return "unit " + getName();
    }
}
