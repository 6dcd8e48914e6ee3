package com.cluster.state.txn;

import com.cluster.state.metrics.NoOpMetricsService;
import com.cluster.state.store.InMemoryDocumentStore;
import com.cluster.state.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Sequences Tests")
class SequencesTest {

    private Sequences sequences;

    @BeforeEach
    void setUp() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        TransactionRunner runner = new TransactionRunner(store, TxnConfig.defaults(),
                new NoOpMetricsService(), new NoOpTracingService());
        sequences = new Sequences(store, runner);
    }

    @Test
    @DisplayName("Should start at zero and count per name")
    void countsPerName() {
        assertEquals(0, sequences.next("machine"));
        assertEquals(1, sequences.next("machine"));
        assertEquals(0, sequences.next("relation"));
        assertEquals(2, sequences.next("machine"));
    }

    @Test
    @DisplayName("Should never hand the same value to concurrent callers")
    void concurrentAllocationIsUnique() throws InterruptedException {
        int threads = 8;
        int perThread = 25;
        Set<Long> seen = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    seen.add(sequences.next("shared"));
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(threads * perThread, seen.size());
        assertEquals(threads * perThread, sequences.next("shared"));
    }
}
