package com.cluster.state.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryDocumentStore Tests")
class InMemoryDocumentStoreTest {

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore("test");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private TxnOp insert(String id, Map<String, Object> doc) {
        return TxnOp.on("things", id).assertThat(Condition.docMissing()).insert(doc);
    }

    @Nested
    @DisplayName("Batches")
    class Batches {

        @Test
        @DisplayName("Should insert documents with revno 1")
        void insertSetsRevno() {
            assertEquals(BatchOutcome.APPLIED, store.runAtomicBatch(List.of(insert("a", Map.of("n", 1)))));

            Map<String, Object> doc = store.findOne("things", "a").orElseThrow();
            assertEquals("a", doc.get(Documents.ID));
            assertEquals(1L, doc.get(Documents.REVNO));
            assertEquals(1L, doc.get("n"));
        }

        @Test
        @DisplayName("Should bump revno on every update")
        void updateBumpsRevno() {
            store.runAtomicBatch(List.of(insert("a", Map.of("n", 1))));
            store.runAtomicBatch(List.of(TxnOp.on("things", "a").update(new Update().inc("n", 2))));

            Map<String, Object> doc = store.findOne("things", "a").orElseThrow();
            assertEquals(2L, Documents.revno(doc));
            assertEquals(3L, doc.get("n"));
        }

        @Test
        @DisplayName("Should apply nothing when any assertion fails")
        void abortIsAllOrNothing() {
            store.runAtomicBatch(List.of(insert("a", Map.of("n", 1))));

            BatchOutcome outcome = store.runAtomicBatch(List.of(
                    TxnOp.on("things", "a").update(new Update().set("n", 5)),
                    TxnOp.on("things", "b").assertThat(Condition.docExists()).check()));

            assertEquals(BatchOutcome.ABORTED, outcome);
            assertEquals(1L, store.findOne("things", "a").orElseThrow().get("n"));
        }

        @Test
        @DisplayName("Should evaluate assertions against the state before the batch")
        void assertionsSeePreBatchState() {
            store.runAtomicBatch(List.of(insert("a", Map.of("n", 1))));

            BatchOutcome outcome = store.runAtomicBatch(List.of(
                    TxnOp.on("things", "a").assertThat(Condition.eq("n", 1)).update(new Update().set("n", 2)),
                    TxnOp.on("things", "a").assertThat(Condition.eq("n", 1)).update(new Update().inc("n", 10))));

            assertEquals(BatchOutcome.APPLIED, outcome);
            assertEquals(12L, store.findOne("things", "a").orElseThrow().get("n"));
        }

        @Test
        @DisplayName("Should ignore updates and removals of missing documents")
        void missingDocumentsAreNoops() {
            BatchOutcome outcome = store.runAtomicBatch(List.of(
                    TxnOp.on("things", "ghost").update(new Update().set("n", 1)),
                    TxnOp.on("things", "ghost").remove()));

            assertEquals(BatchOutcome.APPLIED, outcome);
            assertTrue(store.findOne("things", "ghost").isEmpty());
        }

        @Test
        @DisplayName("Should hand out copies that do not alias stored documents")
        void readsAreCopies() {
            store.runAtomicBatch(List.of(insert("a", Map.of("tags", List.of("x")))));

            Map<String, Object> doc = store.findOne("things", "a").orElseThrow();
            doc.put("n", 99);

            assertFalse(store.findOne("things", "a").orElseThrow().containsKey("n"));
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Should filter and order by id")
        void findManyFiltersAndOrders() {
            store.runAtomicBatch(List.of(
                    insert("c", Map.of("kind", "x")),
                    insert("a", Map.of("kind", "x")),
                    insert("b", Map.of("kind", "y"))));

            List<Map<String, Object>> found = store.findMany("things", Condition.eq("kind", "x"));

            assertEquals(List.of("a", "c"), found.stream().map(d -> d.get(Documents.ID)).toList());
            assertEquals(3, store.count("things", Condition.always()));
        }
    }

    @Nested
    @DisplayName("Change listeners")
    class Listeners {

        @Test
        @DisplayName("Should report revnos and -1 for removals")
        void notifiesChanges() {
            List<String> events = new ArrayList<>();
            store.addChangeListener((collection, id, revno) -> events.add(collection + "/" + id + "@" + revno));

            store.runAtomicBatch(List.of(insert("a", Map.of())));
            store.runAtomicBatch(List.of(TxnOp.on("things", "a").remove()));

            assertEquals(List.of("things/a@1", "things/a@-1"), events);
        }

        @Test
        @DisplayName("Should keep notifying after a listener fails")
        void failingListenerDoesNotBreakBatch() {
            List<String> events = new ArrayList<>();
            store.addChangeListener((collection, id, revno) -> {
                throw new IllegalStateException("boom");
            });
            store.addChangeListener((collection, id, revno) -> events.add(id));

            assertEquals(BatchOutcome.APPLIED, store.runAtomicBatch(List.of(insert("a", Map.of()))));
            assertEquals(List.of("a"), events);
        }
    }

    @Test
    @DisplayName("Should refuse work after close")
    void closedStoreRefusesWork() {
        store.close();

        assertFalse(store.isConnected());
        assertThrows(IllegalStateException.class, () -> store.findOne("things", "a"));
    }
}
