package com.cluster.state.api;

import com.cluster.state.cleanup.Cleanups;
import com.cluster.state.core.model.AssignmentPolicy;
import com.cluster.state.core.model.ContainerType;
import com.cluster.state.core.model.Endpoint;
import com.cluster.state.core.model.MachineTemplate;
import com.cluster.state.entity.AddApplicationArgs;
import com.cluster.state.entity.Application;
import com.cluster.state.entity.Machine;
import com.cluster.state.entity.Model;
import com.cluster.state.entity.Relation;
import com.cluster.state.entity.StateContext;
import com.cluster.state.entity.Unit;
import com.cluster.state.entity.UnitRemovalPolicy;
import com.cluster.state.errors.MachineInUseException;
import com.cluster.state.logging.LogContext;
import com.cluster.state.metrics.MetricsService;
import com.cluster.state.metrics.NoOpMetricsService;
import com.cluster.state.network.RelationNetworkDirection;
import com.cluster.state.network.RelationNetworks;
import com.cluster.state.offer.ApplicationOffers;
import com.cluster.state.offer.OfferConnections;
import com.cluster.state.registry.InstanceRegistry;
import com.cluster.state.settings.Settings;
import com.cluster.state.store.BatchOutcome;
import com.cluster.state.store.DocumentCodec;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.store.InMemoryDocumentStore;
import com.cluster.state.tracing.NoOpTracingService;
import com.cluster.state.tracing.TracingService;
import com.cluster.state.txn.TransactionRunner;
import com.cluster.state.txn.TxnConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point of the cluster state library: one model's machines,
 * applications, units and relations persisted in a {@link DocumentStore}.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (ClusterState state = ClusterState.builder().inMemory().build()) {
 *     Application app = state.addApplication(AddApplicationArgs.builder("wordpress")
 *             .series("jammy")
 *             .charmUrl("ch:wordpress-1")
 *             .build());
 *     Unit unit = app.addUnit();
 *     state.assignUnit(unit, AssignmentPolicy.NEW);
 *     unit.destroy();
 * }
 * </pre>
 *
 * <p>Every mutation is an optimistic transaction; concurrent writers are safe
 * and callers only see {@code ExcessiveContentionException} when the state keeps
 * changing under them.</p>
 */
public class ClusterState implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterState.class);

    private final DocumentStore store;
    private final boolean ownsStore;
    private final InstanceRegistry registry;
    private final StateContext context;
    private final Cleanups cleanups;
    private final ApplicationOffers applicationOffers;
    private final OfferConnections offerConnections;
    private final AtomicBoolean closed = new AtomicBoolean();

    private ClusterState(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "a document store is required");
        this.ownsStore = builder.ownsStore;
        this.registry = builder.registry != null ? builder.registry : new InstanceRegistry();

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        UnitRemovalPolicy removalPolicy = builder.removalPolicy != null
                ? builder.removalPolicy : UnitRemovalPolicy.whileAllocating();

        TransactionRunner runner = new TransactionRunner(store, builder.txnConfig, metricsService, tracingService);
        this.context = new StateContext(store, new DocumentCodec(), runner, removalPolicy, metricsService);
        this.cleanups = new Cleanups(context);
        this.applicationOffers = new ApplicationOffers(context);
        this.offerConnections = new OfferConnections(context);

        BatchOutcome created = runner.runOnce("create model",
                List.of(Model.createOp(UUID.randomUUID().toString(), builder.modelName)));
        if (created == BatchOutcome.ABORTED) {
            log.debug("Model already present in store {}", store.getName());
        }

        registry.register(this);
        log.info("ClusterState initialized with store: {}", store.getName());
    }

    // ========== Model ==========

    public Model model() {
        return context.model();
    }

    // ========== Machines ==========

    public Machine addMachine(MachineTemplate template) {
        return Machine.add(context, template);
    }

    public Machine addMachineInside(MachineTemplate template, String parentId, ContainerType type) {
        return Machine.addInside(context, template, parentId, type);
    }

    public Machine machine(String id) {
        return context.machine(id);
    }

    public List<Machine> allMachines() {
        return context.machines();
    }

    // ========== Applications and units ==========

    public Application addApplication(AddApplicationArgs args) {
        return Application.add(context, args);
    }

    public Application application(String name) {
        return context.application(name);
    }

    public List<Application> allApplications() {
        return context.applications();
    }

    public Unit unit(String name) {
        return context.unit(name);
    }

    /**
     * Places a principal unit according to {@code policy}. The clean policies
     * fall back to a new machine when no clean machine is left.
     */
    public Machine assignUnit(Unit unit, AssignmentPolicy policy) {
        try (LogContext lc = LogContext.forAssignment(unit.getName(), policy.name())) {
            Machine machine = switch (policy) {
                case LOCAL -> {
                    Machine local = context.machine("0");
                    unit.assignToMachine(local);
                    yield local;
                }
                case CLEAN -> assignClean(unit, false);
                case CLEAN_EMPTY -> assignClean(unit, true);
                case NEW -> unit.assignToNewMachine();
            };
            log.debug("Unit {} assigned to machine {}", unit.getName(), machine.getId());
            return machine;
        }
    }

    private Machine assignClean(Unit unit, boolean requireEmpty) {
        try {
            return requireEmpty ? unit.assignToCleanEmptyMachine() : unit.assignToCleanMachine();
        } catch (MachineInUseException e) {
            log.debug("No clean machine for unit {}, using a new one", unit.getName());
            return unit.assignToNewMachineOrContainer();
        }
    }

    // ========== Relations ==========

    public Relation addRelation(Endpoint... endpoints) {
        return Relation.add(context, endpoints);
    }

    public Relation relation(String key) {
        return context.relation(key);
    }

    public Relation relation(long id) {
        return context.relationById(id);
    }

    public List<Relation> allRelations() {
        return context.relations();
    }

    public RelationNetworks relationNetworks(RelationNetworkDirection direction) {
        return new RelationNetworks(context, direction);
    }

    // ========== Offers ==========

    public ApplicationOffers applicationOffers() {
        return applicationOffers;
    }

    public OfferConnections offerConnections() {
        return offerConnections;
    }

    // ========== Settings ==========

    public Settings createSettings(String key, Map<String, ?> values) {
        return context.settings().create(key, values);
    }

    public Settings readSettings(String key) {
        return context.settings().read(key);
    }

    public void removeSettings(String key) {
        context.settings().remove(key);
    }

    // ========== Cleanups ==========

    public boolean needsCleanup() {
        return cleanups.needsCleanup();
    }

    /**
     * Runs queued cleanups once.
     *
     * @return the number completed
     */
    public int cleanup() {
        return cleanups.run();
    }

    // ========== Lifecycle ==========

    public StateContext getContext() {
        return context;
    }

    public InstanceRegistry getRegistry() {
        return registry;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        registry.unregister(this);
        if (ownsStore) {
            try {
                store.close();
            } catch (Exception e) {
                log.warn("Error closing document store", e);
            }
        }
        log.info("ClusterState closed");
    }

    @Override
    public String toString() {
        return "ClusterState[" + store.getName() + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DocumentStore store;
        private boolean ownsStore = false;
        private TxnConfig txnConfig = TxnConfig.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private InstanceRegistry registry;
        private UnitRemovalPolicy removalPolicy;
        private String modelName = "default";

        /**
         * Uses an existing store. The store is not closed with the state.
         */
        public Builder documentStore(DocumentStore store) {
            this.store = store;
            this.ownsStore = false;
            return this;
        }

        /**
         * Uses a new in-memory store owned by the state.
         */
        public Builder inMemory() {
            this.store = new InMemoryDocumentStore();
            this.ownsStore = true;
            return this;
        }

        public Builder txnConfig(TxnConfig txnConfig) {
            this.txnConfig = Objects.requireNonNull(txnConfig);
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom tracing service for transaction spans.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Registry the state registers with while open.
         */
        public Builder instanceRegistry(InstanceRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder unitRemovalPolicy(UnitRemovalPolicy removalPolicy) {
            this.removalPolicy = removalPolicy;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = Objects.requireNonNull(modelName);
            return this;
        }

        public ClusterState build() {
            return new ClusterState(this);
        }
    }
}
