package com.cluster.state.txn;

import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.store.Documents;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Allocates monotonically increasing ids from named counters stored as documents.
 * Each allocation is its own transaction; concurrent callers never receive the same value.
 */
public class Sequences {

    private static final String COUNTER = "counter";

    private final DocumentStore store;
    private final TransactionRunner runner;

    public Sequences(DocumentStore store, TransactionRunner runner) {
        this.store = store;
        this.runner = runner;
    }

    /**
     * Returns the next value of sequence {@code name}, starting at 0.
     */
    public long next(String name) {
        AtomicLong allocated = new AtomicLong();
        runner.run("sequence " + name, attempt -> {
            Optional<Map<String, Object>> doc = store.findOne(CollectionNames.SEQUENCE, name);
            if (doc.isEmpty()) {
                allocated.set(0);
                return List.of(TxnOp.on(CollectionNames.SEQUENCE, name)
                        .assertThat(Condition.docMissing())
                        .insert(Map.of("name", name, COUNTER, 1L)));
            }
            long counter = Documents.longValue(doc.get(), COUNTER);
            allocated.set(counter);
            return List.of(TxnOp.on(CollectionNames.SEQUENCE, name)
                    .assertThat(Condition.eq(COUNTER, counter))
                    .update(new Update().set(COUNTER, counter + 1)));
        }, runner.getConfig().sequenceMaxAttempts());
        return allocated.get();
    }
}
