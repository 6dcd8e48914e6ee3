package com.cluster.state.txn;

import com.cluster.state.errors.NotFoundException;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.store.Documents;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reference counters kept as documents, so a count can change in the same
 * atomic batch as the write it guards.
 *
 * <p>Every op built here asserts what it read, which makes a batch containing
 * it abort if another writer moved the counter in between.</p>
 */
public class RefCounts {

    static final String COUNT = "refcount";

    private final DocumentStore store;
    private final String collection;

    public RefCounts(DocumentStore store) {
        this(store, CollectionNames.REFCOUNTS);
    }

    public RefCounts(DocumentStore store, String collection) {
        this.store = store;
        this.collection = collection;
    }

    /**
     * Result of a decrement: the ops to run and whether they drop the last reference.
     */
    public record DecRef(List<TxnOp> ops, boolean lastRef) {
    }

    /**
     * Reads the current count; a missing counter reads as zero.
     */
    public long read(String key) {
        return store.findOne(collection, key)
                .map(doc -> Documents.longValue(doc, COUNT))
                .orElse(0L);
    }

    /**
     * Increments an existing counter.
     *
     * @throws NotFoundException if the counter does not exist
     */
    public TxnOp incRefOp(String key) {
        if (store.findOne(collection, key).isEmpty()) {
            throw new NotFoundException("reference count " + key + " not found");
        }
        return TxnOp.on(collection, key)
                .assertThat(Condition.docExists())
                .update(new Update().inc(COUNT, 1));
    }

    /**
     * Increments a counter, creating it with a count of one if needed.
     */
    public TxnOp createOrIncRefOp(String key) {
        if (store.findOne(collection, key).isEmpty()) {
            return TxnOp.on(collection, key)
                    .assertThat(Condition.docMissing())
                    .insert(Map.of(COUNT, 1L));
        }
        return TxnOp.on(collection, key)
                .assertThat(Condition.docExists())
                .update(new Update().inc(COUNT, 1));
    }

    /**
     * Decrements a counter, removing its document when the last reference goes.
     * A missing counter yields no ops.
     */
    public DecRef decRefOps(String key) {
        return decRefOps(key, 1);
    }

    /**
     * Drops {@code n} references at once, for batches that release several
     * holders of the same counter.
     */
    public DecRef decRefOps(String key, long n) {
        Optional<Map<String, Object>> doc = store.findOne(collection, key);
        if (doc.isEmpty()) {
            return new DecRef(List.of(), false);
        }
        long count = Documents.longValue(doc.get(), COUNT);
        if (count <= n) {
            return new DecRef(List.of(TxnOp.on(collection, key)
                    .assertThat(Condition.eq(COUNT, count))
                    .remove()), true);
        }
        return new DecRef(List.of(TxnOp.on(collection, key)
                .assertThat(Condition.gt(COUNT, n))
                .update(new Update().inc(COUNT, -n))), false);
    }

    /**
     * Asserts the counter holds exactly {@code expected}; zero also matches a missing counter.
     */
    public TxnOp assertCountOp(String key, long expected) {
        Condition condition = expected == 0
                ? Condition.or(Condition.docMissing(), Condition.eq(COUNT, 0L))
                : Condition.eq(COUNT, expected);
        return TxnOp.on(collection, key).assertThat(condition).check();
    }

    /**
     * Removes a counter unconditionally.
     */
    public TxnOp removeOp(String key) {
        return TxnOp.on(collection, key).remove();
    }
}
