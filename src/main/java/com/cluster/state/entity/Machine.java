package com.cluster.state.entity;

import com.cluster.state.cleanup.CleanupKind;
import com.cluster.state.cleanup.Cleanups;
import com.cluster.state.core.model.AgentStatus;
import com.cluster.state.core.model.ContainerType;
import com.cluster.state.core.model.Life;
import com.cluster.state.core.model.MachineJob;
import com.cluster.state.core.model.MachineTemplate;
import com.cluster.state.errors.AlreadyExistsException;
import com.cluster.state.errors.HasAssignedUnitsException;
import com.cluster.state.errors.HasContainersException;
import com.cluster.state.errors.NotAliveException;
import com.cluster.state.errors.NotDeadException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.errors.NotValidException;
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
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * A machine, or a container inside one, that can host units.
 */
public class Machine {

    private static final Logger log = LoggerFactory.getLogger(Machine.class);

    static final String CHILDREN = "children";

    private final StateContext ctx;
    private MachineDoc doc;

    Machine(StateContext ctx, MachineDoc doc) {
        this.ctx = ctx;
        this.doc = doc;
    }

    // ========== Creation ==========

    /**
     * Adds a top-level machine.
     *
     * @throws NotAliveException if the model is not alive
     */
    public static Machine add(StateContext ctx, MachineTemplate template) {
        String id = String.valueOf(ctx.sequences().next("machine"));
        MachineDoc machine = newDoc(id, template.getSeries(), List.copyOf(template.getJobs()),
                List.of(), ContainerType.NONE, template.getInstanceId());
        ctx.runner().run("add machine " + id, attempt -> {
            ctx.checkModelAlive();
            List<TxnOp> ops = new ArrayList<>();
            ops.add(ctx.assertModelAliveOp());
            ops.addAll(insertOps(ctx, machine, List.of()));
            return ops;
        });
        log.info("Machine {} added", id);
        return ctx.machine(id);
    }

    /**
     * Adds a container of {@code type} inside {@code parentId}.
     *
     * @throws NotAliveException if the parent or the model is not alive
     */
    public static Machine addInside(StateContext ctx, MachineTemplate template, String parentId, ContainerType type) {
        if (!type.isContainer()) {
            throw new NotValidException("container type required to add a machine inside " + parentId);
        }
        String id = newContainerId(ctx, parentId, type);
        MachineDoc container = newDoc(id, template.getSeries(), List.copyOf(template.getJobs()),
                List.of(), type, template.getInstanceId());
        ctx.runner().run("add container " + id, attempt -> {
            ctx.checkModelAlive();
            MachineDoc parent = ctx.machineDoc(parentId)
                    .orElseThrow(() -> new NotFoundException("machine " + parentId + " not found"));
            if (parent.life() != Life.ALIVE) {
                throw new NotAliveException("machine " + parentId + " is not alive");
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(ctx.assertModelAliveOp());
            ops.add(TxnOp.on(CollectionNames.MACHINES, parentId)
                    .assertThat(LifeAsserts.isAlive())
                    .check());
            ops.add(TxnOp.on(CollectionNames.CONTAINER_REFS, parentId)
                    .assertThat(Condition.docExists())
                    .update(new Update().addToSet(CHILDREN, id)));
            ops.addAll(insertOps(ctx, container, List.of()));
            return ops;
        });
        log.info("Container {} added", id);
        return ctx.machine(id);
    }

    static String newContainerId(StateContext ctx, String parentId, ContainerType type) {
        String kind = type.name().toLowerCase(Locale.ROOT);
        return parentId + "/" + kind + "/" + ctx.sequences().next("machine" + parentId + "/" + kind);
    }

    static MachineDoc newDoc(String id, String series, List<MachineJob> jobs, List<String> principals,
                             ContainerType type, String instanceId) {
        return new MachineDoc(id, series, jobs, principals, principals.isEmpty(), false, type,
                instanceId, Life.ALIVE, 0);
    }

    /**
     * Ops inserting a machine with its container references and status.
     */
    static List<TxnOp> insertOps(StateContext ctx, MachineDoc machine, List<String> children) {
        return List.of(
                TxnOp.on(CollectionNames.MACHINES, machine.id())
                        .assertThat(Condition.docMissing())
                        .insert(ctx.codec().toDocument(machine)),
                TxnOp.on(CollectionNames.CONTAINER_REFS, machine.id())
                        .assertThat(Condition.docMissing())
                        .insert(Map.of(CHILDREN, children)),
                StatusDocs.insertOp(StatusDocs.machineKey(machine.id()), AgentStatus.ALLOCATING));
    }

    static List<String> containerChildren(StateContext ctx, String machineId) {
        return ctx.store().findOne(CollectionNames.CONTAINER_REFS, machineId)
                .map(refs -> Documents.listValue(refs, CHILDREN).stream()
                        .map(String::valueOf)
                        .toList())
                .orElse(List.of());
    }

    // ========== Accessors ==========

    public String getId() {
        return doc.id();
    }

    public String getSeries() {
        return doc.series();
    }

    public Life getLife() {
        return doc.life();
    }

    public List<MachineJob> getJobs() {
        return doc.jobs();
    }

    /**
     * Names of the principal units assigned to this machine.
     */
    public List<String> getPrincipalUnits() {
        return doc.principals();
    }

    /**
     * Whether the machine has never hosted a unit.
     */
    public boolean isClean() {
        return doc.clean();
    }

    public boolean hasVote() {
        return doc.hasVote();
    }

    public ContainerType getContainerType() {
        return doc.containerType();
    }

    public String getInstanceId() {
        return doc.instanceId();
    }

    public boolean isContainer() {
        return doc.containerType().isContainer();
    }

    /**
     * Id of the hosting machine, or empty for a top-level machine.
     */
    public String getParentId() {
        return Names.parentOf(getId());
    }

    /**
     * Ids of the containers hosted by this machine.
     */
    public List<String> containers() {
        return containerChildren(ctx, getId());
    }

    public void refresh() {
        doc = ctx.machineDoc(getId())
                .orElseThrow(() -> new NotFoundException("machine " + getId() + " not found"));
    }

    // ========== Lifecycle ==========

    /**
     * Sets the machine Dying. Units assigned to it must already be on their
     * way out, either themselves or through their application.
     *
     * @throws PolicyViolationException  if the machine manages the model
     * @throws HasContainersException    if it hosts containers
     * @throws HasAssignedUnitsException if an Alive unit of an Alive application is assigned
     */
    public void destroy() {
        String id = getId();
        AtomicBoolean changed = new AtomicBoolean();
        ctx.runner().run("destroy machine " + id, attempt -> {
            changed.set(false);
            MachineDoc fresh = ctx.machineDoc(id).orElse(null);
            if (fresh == null || fresh.life() != Life.ALIVE) {
                return List.of();
            }
            checkRemovable(fresh);
            List<TxnOp> ops = new ArrayList<>();
            for (String principal : fresh.principals()) {
                UnitDoc unit = ctx.unitDoc(principal).orElse(null);
                if (unit == null) {
                    continue;
                }
                if (unit.life() != Life.ALIVE) {
                    ops.add(TxnOp.on(CollectionNames.UNITS, principal)
                            .assertThat(Condition.ne(LifeAsserts.LIFE, Life.ALIVE))
                            .check());
                    continue;
                }
                ApplicationDoc app = ctx.applicationDoc(unit.application()).orElse(null);
                if (app == null || app.life() == Life.ALIVE) {
                    throw new HasAssignedUnitsException("machine " + id + " has unit \"" + principal + "\" assigned");
                }
                ops.add(TxnOp.on(CollectionNames.APPLICATIONS, app.name())
                        .assertThat(Condition.ne(LifeAsserts.LIFE, Life.ALIVE))
                        .check());
            }
            ops.add(TxnOp.on(CollectionNames.MACHINES, id)
                    .assertThat(Condition.and(LifeAsserts.isAlive(),
                            Condition.listEquals(MachineDoc.PRINCIPALS, fresh.principals())))
                    .update(new Update().set(LifeAsserts.LIFE, Life.DYING)));
            ops.add(noContainersOp(id));
            if (!fresh.principals().isEmpty()) {
                ops.add(Cleanups.newCleanupOp(CleanupKind.DYING_MACHINE, id));
            }
            changed.set(true);
            return ops;
        });
        if (changed.get()) {
            log.info("Machine {} is dying", id);
            ctx.metrics().recordLifeTransition("machine", Life.DYING);
        }
        refreshIfPresent();
    }

    /**
     * Sets the machine Dead. Every unit and container must be gone first.
     *
     * @throws HasAssignedUnitsException if units are still assigned
     * @throws HasContainersException    if containers remain
     * @throws PolicyViolationException  if the machine manages the model or has a vote
     */
    public void ensureDead() {
        String id = getId();
        AtomicBoolean changed = new AtomicBoolean();
        ctx.runner().run("ensure dead machine " + id, attempt -> {
            changed.set(false);
            MachineDoc fresh = ctx.machineDoc(id).orElse(null);
            if (fresh == null || fresh.life() == Life.DEAD) {
                return List.of();
            }
            checkRemovable(fresh);
            if (fresh.hasVote()) {
                throw new PolicyViolationException("machine " + id + " is still a voting member");
            }
            if (!fresh.principals().isEmpty()) {
                throw new HasAssignedUnitsException(
                        "machine " + id + " has unit \"" + fresh.principals().get(0) + "\" assigned");
            }
            changed.set(true);
            return List.of(
                    TxnOp.on(CollectionNames.MACHINES, id)
                            .assertThat(Condition.and(LifeAsserts.notDead(),
                                    Condition.emptyOrMissing(MachineDoc.PRINCIPALS),
                                    Condition.eq(MachineDoc.HAS_VOTE, false)))
                            .update(new Update().set(LifeAsserts.LIFE, Life.DEAD)),
                    noContainersOp(id));
        });
        if (changed.get()) {
            ctx.metrics().recordLifeTransition("machine", Life.DEAD);
        }
        refreshIfPresent();
    }

    /**
     * Removes a Dead machine with its status and container references.
     * Removing a machine that is already gone is a no-op.
     *
     * @throws NotDeadException if the machine is not Dead
     */
    public void remove() {
        String id = getId();
        AtomicBoolean removed = new AtomicBoolean();
        ctx.runner().run("remove machine " + id, attempt -> {
            removed.set(false);
            MachineDoc fresh = ctx.machineDoc(id).orElse(null);
            if (fresh == null) {
                return List.of();
            }
            if (fresh.life() != Life.DEAD) {
                throw new NotDeadException("cannot remove machine " + id + ": machine is not dead");
            }
            List<TxnOp> ops = new ArrayList<>();
            ops.add(TxnOp.on(CollectionNames.MACHINES, id)
                    .assertThat(LifeAsserts.isDead())
                    .remove());
            ops.add(TxnOp.on(CollectionNames.CONTAINER_REFS, id).remove());
            ops.add(StatusDocs.removeOp(StatusDocs.machineKey(id)));
            String parent = Names.parentOf(id);
            if (!parent.isEmpty()) {
                ops.add(TxnOp.on(CollectionNames.CONTAINER_REFS, parent)
                        .update(new Update().pull(CHILDREN, id)));
            }
            removed.set(true);
            return ops;
        });
        if (removed.get()) {
            log.info("Machine {} removed", id);
            ctx.metrics().incrementRemoved("machine");
        }
    }

    private void checkRemovable(MachineDoc fresh) {
        if (fresh.hasJob(MachineJob.MANAGE_MODEL)) {
            throw new PolicyViolationException("machine " + fresh.id() + " is required by the model");
        }
        List<String> containers = containerChildren(ctx, fresh.id());
        if (!containers.isEmpty()) {
            throw new HasContainersException("machine " + fresh.id() + " is hosting containers "
                    + containers.stream().map(c -> "\"" + c + "\"").collect(Collectors.joining(", ")));
        }
    }

    static TxnOp noContainersOp(String machineId) {
        return TxnOp.on(CollectionNames.CONTAINER_REFS, machineId)
                .assertThat(Condition.or(Condition.docMissing(), Condition.emptyOrMissing(CHILDREN)))
                .check();
    }

    private void refreshIfPresent() {
        ctx.machineDoc(getId()).ifPresent(fresh -> doc = fresh);
    }

    // ========== Provisioning ==========

    /**
     * Records the provider instance backing this machine.
     *
     * @throws AlreadyExistsException if an instance is already recorded
     * @throws NotAliveException      if the machine is Dead
     */
    public void setProvisioned(String instanceId) {
        String id = getId();
        ctx.runner().run("provision machine " + id, attempt -> {
            MachineDoc fresh = ctx.machineDoc(id)
                    .orElseThrow(() -> new NotFoundException("machine " + id + " not found"));
            if (fresh.life() == Life.DEAD) {
                throw new NotAliveException("machine " + id + " is dead");
            }
            if (!fresh.instanceId().isEmpty()) {
                throw new AlreadyExistsException("machine " + id + " already provisioned as " + fresh.instanceId());
            }
            return List.of(TxnOp.on(CollectionNames.MACHINES, id)
                    .assertThat(Condition.and(LifeAsserts.notDead(), Condition.eq(MachineDoc.INSTANCE_ID, "")))
                    .update(new Update().set(MachineDoc.INSTANCE_ID, instanceId)));
        });
        refresh();
    }

    /**
     * Marks whether this machine is a voting member of the controller cluster.
     * A voting machine cannot become Dead, nor be the target of a unit cascade.
     */
    public void setHasVote(boolean hasVote) {
        String id = getId();
        ctx.runner().run("set vote of machine " + id, attempt -> {
            MachineDoc fresh = ctx.machineDoc(id)
                    .orElseThrow(() -> new NotFoundException("machine " + id + " not found"));
            if (fresh.life() == Life.DEAD) {
                throw new NotAliveException("machine " + id + " is dead");
            }
            if (fresh.hasVote() == hasVote) {
                return List.of();
            }
            return List.of(TxnOp.on(CollectionNames.MACHINES, id)
                    .assertThat(LifeAsserts.notDead())
                    .update(new Update().set(MachineDoc.HAS_VOTE, hasVote)));
        });
        refresh();
    }

    @Override
    public String toString() {
        return "machine " + getId();
    }
}
