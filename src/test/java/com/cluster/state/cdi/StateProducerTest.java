package com.cluster.state.cdi;

import com.cluster.state.api.ClusterState;
import com.cluster.state.core.model.AgentStatus;
import com.cluster.state.core.model.Life;
import com.cluster.state.entity.AddApplicationArgs;
import com.cluster.state.entity.Unit;
import com.cluster.state.registry.InstanceRegistry;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.store.InMemoryDocumentStore;
import com.cluster.state.txn.TxnConfig;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StateProducer Tests")
class StateProducerTest {

    @Mock
    private Instance<DocumentStore> documentStores;

    private StateProducer producer;

    @BeforeEach
    void setUp() {
        producer = new StateProducer();
        producer.modelName = "default";
        producer.txnMaxAttempts = 3;
        producer.txnRetryDelayMs = 0;
        producer.sequenceMaxAttempts = 100;
        producer.unitRemovalShortCircuit = true;
        producer.documentStores = documentStores;
    }

    @Test
    @DisplayName("Should build the transaction config from properties")
    void txnConfig() {
        producer.txnMaxAttempts = 5;
        producer.txnRetryDelayMs = 20;

        assertEquals(new TxnConfig(5, 20, 100), producer.txnConfig());
    }

    @Test
    @DisplayName("Should fall back to an in-memory store")
    void inMemoryFallback() {
        when(documentStores.isResolvable()).thenReturn(false);
        InstanceRegistry registry = producer.instanceRegistry();

        ClusterState state = producer.clusterState(registry);

        assertTrue(registry.contains(state));
        assertEquals("default", state.model().getName());
        producer.closeState(state);
        assertTrue(state.isClosed());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Should use the application's document store")
    void injectedStore() {
        InMemoryDocumentStore store = new InMemoryDocumentStore("injected");
        when(documentStores.isResolvable()).thenReturn(true);
        when(documentStores.get()).thenReturn(store);
        producer.modelName = "prod";

        ClusterState state = producer.clusterState(producer.instanceRegistry());
        producer.closeState(state);

        assertTrue(store.isConnected());
        assertTrue(store.findAll("model").stream().anyMatch(doc -> "prod".equals(doc.get("name"))));
    }

    @Test
    @DisplayName("Should disable direct unit removal when configured")
    void shortCircuitDisabled() {
        when(documentStores.isResolvable()).thenReturn(false);
        producer.unitRemovalShortCircuit = false;

        try (ClusterState state = producer.clusterState(producer.instanceRegistry())) {
            Unit unit = state.addApplication(AddApplicationArgs.builder("wordpress")
                    .series("jammy")
                    .charmUrl("ch:wordpress-1")
                    .build()).addUnit();
            assertEquals(AgentStatus.ALLOCATING, unit.agentStatus());

            unit.destroy();

            assertEquals(Life.DYING, state.unit(unit.getName()).getLife());
        }
    }

    @Test
    @DisplayName("Should close leaked instances when the registry is disposed")
    void registryDisposal() {
        when(documentStores.isResolvable()).thenReturn(false);
        InstanceRegistry registry = producer.instanceRegistry();
        ClusterState leaked = producer.clusterState(registry);

        producer.closeRegistry(registry);

        assertTrue(leaked.isClosed());
    }
}
