package com.cluster.state.cdi;

import com.cluster.state.api.ClusterState;
import com.cluster.state.entity.UnitRemovalPolicy;
import com.cluster.state.registry.InstanceRegistry;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.txn.TxnConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the cluster state library from MicroProfile Config properties.
 *
 * <p>A {@link DocumentStore} bean is used when the application provides one;
 * otherwise the state runs on an in-memory store.</p>
 *
 * <pre>
 * cluster-state:
 *   model-name: production
 *   txn:
 *     max-attempts: 3
 *     retry-delay-ms: 0
 *     sequence-max-attempts: 100
 *   unit-removal:
 *     short-circuit: true
 * </pre>
 */
@ApplicationScoped
public class StateProducer {

    private static final Logger log = LoggerFactory.getLogger(StateProducer.class);

    // ── Model ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "cluster-state.model-name", defaultValue = "default")
    String modelName;

    // ── Transactions ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "cluster-state.txn.max-attempts", defaultValue = "3")
    int txnMaxAttempts;

    @Inject
    @ConfigProperty(name = "cluster-state.txn.retry-delay-ms", defaultValue = "0")
    long txnRetryDelayMs;

    @Inject
    @ConfigProperty(name = "cluster-state.txn.sequence-max-attempts", defaultValue = "100")
    int sequenceMaxAttempts;

    // ── Units ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "cluster-state.unit-removal.short-circuit", defaultValue = "true")
    boolean unitRemovalShortCircuit;

    @Inject
    Instance<DocumentStore> documentStores;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public InstanceRegistry instanceRegistry() {
        return new InstanceRegistry();
    }

    public void closeRegistry(@Disposes InstanceRegistry registry) {
        int leaked = registry.closeAll();
        if (leaked > 0) {
            log.warn("Closed {} cluster state instance(s) left open at shutdown", leaked);
        }
    }

    @Produces
    @ApplicationScoped
    public ClusterState clusterState(InstanceRegistry registry) {
        TxnConfig txnConfig = txnConfig();
        log.info("Producing ClusterState: model={} maxAttempts={} shortCircuit={}",
                modelName, txnConfig.maxAttempts(), unitRemovalShortCircuit);

        ClusterState.Builder builder = ClusterState.builder()
                .txnConfig(txnConfig)
                .instanceRegistry(registry)
                .modelName(modelName)
                .unitRemovalPolicy(unitRemovalShortCircuit
                        ? UnitRemovalPolicy.whileAllocating() : UnitRemovalPolicy.never());

        if (documentStores != null && documentStores.isResolvable()) {
            builder.documentStore(documentStores.get());
        } else {
            log.info("No DocumentStore bean found, using in-memory store");
            builder.inMemory();
        }
        return builder.build();
    }

    public void closeState(@Disposes ClusterState state) {
        log.info("Closing ClusterState");
        state.close();
    }

    TxnConfig txnConfig() {
        return new TxnConfig(txnMaxAttempts, txnRetryDelayMs, sequenceMaxAttempts);
    }
}
