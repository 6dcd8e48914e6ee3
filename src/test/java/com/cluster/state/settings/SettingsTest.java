package com.cluster.state.settings;

import com.cluster.state.errors.AlreadyExistsException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.metrics.NoOpMetricsService;
import com.cluster.state.store.InMemoryDocumentStore;
import com.cluster.state.tracing.NoOpTracingService;
import com.cluster.state.txn.TransactionRunner;
import com.cluster.state.txn.TxnConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Settings Tests")
class SettingsTest {

    private SettingsCollection settings;

    @BeforeEach
    void setUp() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        TransactionRunner runner = new TransactionRunner(store, TxnConfig.defaults(),
                new NoOpMetricsService(), new NoOpTracingService());
        settings = new SettingsCollection(store, runner);
    }

    @Nested
    @DisplayName("Delta writes")
    class DeltaWrites {

        @Test
        @DisplayName("Should report additions, deletions and the final values")
        void roundTrip() {
            settings.create("cfg", Map.of("a", 1L));

            Settings s = settings.read("cfg");
            s.set("b", 2L);
            assertEquals(List.of(ItemChange.added("b", 2L)), s.write());

            s.delete("a");
            assertEquals(List.of(ItemChange.deleted("a", 1L)), s.write());

            assertEquals(Map.of("b", 2L), settings.read("cfg").map());
        }

        @Test
        @DisplayName("Should report modifications with old and new values")
        void modification() {
            settings.create("cfg", Map.of("a", 1L));

            Settings s = settings.read("cfg");
            s.set("a", 5L);

            assertEquals(List.of(ItemChange.modified("a", 1L, 5L)), s.write());
        }

        @Test
        @DisplayName("Should write nothing when nothing changed")
        void noChanges() {
            settings.create("cfg", Map.of("a", 1L));

            Settings s = settings.read("cfg");
            s.set("a", 1L);

            assertTrue(s.write().isEmpty());
        }

        @Test
        @DisplayName("Should order changes by key")
        void sortedChanges() {
            settings.create("cfg", Map.of());

            Settings s = settings.read("cfg");
            s.set("z", 1L);
            s.set("m", 1L);
            s.set("a", 1L);

            assertEquals(List.of("a", "m", "z"), s.write().stream().map(ItemChange::key).toList());
        }

        @Test
        @DisplayName("Should rebase onto a concurrent writer's changes")
        void rebaseOnConflict() {
            settings.create("cfg", Map.of("a", 1L));
            Settings first = settings.read("cfg");
            Settings second = settings.read("cfg");

            first.set("x", 1L);
            first.write();

            second.set("y", 2L);
            assertEquals(List.of(ItemChange.added("y", 2L)), second.write());

            assertEquals(Map.of("a", 1L, "x", 1L, "y", 2L), settings.read("cfg").map());
            assertEquals(Map.of("a", 1L, "x", 1L, "y", 2L), second.map());
        }
    }

    @Nested
    @DisplayName("Collection")
    class Collection {

        @Test
        @DisplayName("Should refuse a duplicate key")
        void duplicateCreate() {
            settings.create("cfg", Map.of());

            assertThrows(AlreadyExistsException.class, () -> settings.create("cfg", Map.of()));
        }

        @Test
        @DisplayName("Should report missing documents")
        void missing() {
            assertThrows(NotFoundException.class, () -> settings.read("nope"));
            assertThrows(NotFoundException.class, () -> settings.remove("nope"));
        }

        @Test
        @DisplayName("Should fail to write once the document is removed")
        void writeAfterRemove() {
            settings.create("cfg", Map.of("a", 1L));
            Settings s = settings.read("cfg");
            settings.remove("cfg");

            s.set("b", 1L);

            assertThrows(NotFoundException.class, s::write);
        }
    }
}
