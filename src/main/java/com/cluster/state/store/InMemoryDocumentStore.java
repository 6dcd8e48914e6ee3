package com.cluster.state.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link DocumentStore}.
 * Batches are serialized on the store's monitor, which gives the same
 * all-or-nothing visibility a transactional database provides. Reads return
 * deep copies so callers never observe a half-applied batch.
 *
 * <p>Suitable for tests, embedded use and single-process deployments.</p>
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final String name;
    private final Map<String, TreeMap<String, Map<String, Object>>> collections = new HashMap<>();
    private final List<ChangeListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    public InMemoryDocumentStore() {
        this("cluster-state");
    }

    public InMemoryDocumentStore(String name) {
        this.name = name;
    }

    @Override
    public synchronized Optional<Map<String, Object>> findOne(String collection, String id) {
        ensureOpen();
        return Optional.ofNullable(Documents.copy(collection(collection).get(id)));
    }

    @Override
    public synchronized List<Map<String, Object>> findMany(String collection, Condition filter) {
        ensureOpen();
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> doc : collection(collection).values()) {
            if (filter.test(doc)) {
                result.add(Documents.copy(doc));
            }
        }
        return result;
    }

    @Override
    public BatchOutcome runAtomicBatch(List<TxnOp> ops) {
        Map<String, Long> changes = new LinkedHashMap<>();
        synchronized (this) {
            ensureOpen();
            for (TxnOp op : ops) {
                Map<String, Object> current = collection(op.getCollection()).get(op.getId());
                if (op.getAssertion() != null && !op.getAssertion().test(current)) {
                    log.debug("batch.aborted op={}", op);
                    return BatchOutcome.ABORTED;
                }
            }
            for (TxnOp op : ops) {
                apply(op, changes);
            }
        }
        changes.forEach((key, revno) -> {
            int split = key.indexOf('/');
            String collection = key.substring(0, split);
            String id = key.substring(split + 1);
            for (ChangeListener listener : listeners) {
                try {
                    listener.onChange(collection, id, revno);
                } catch (RuntimeException e) {
                    log.warn("Change listener failed for {}/{}", collection, id, e);
                }
            }
        });
        return BatchOutcome.APPLIED;
    }

    private void apply(TxnOp op, Map<String, Long> changes) {
        TreeMap<String, Map<String, Object>> docs = collection(op.getCollection());
        Map<String, Object> current = docs.get(op.getId());
        String key = op.getCollection() + "/" + op.getId();
        switch (op.getKind()) {
            case ASSERT -> {
            }
            case INSERT -> {
                if (current == null) {
                    Map<String, Object> doc = Documents.copy(op.getInsert());
                    doc.put(Documents.ID, op.getId());
                    doc.put(Documents.REVNO, 1L);
                    docs.put(op.getId(), doc);
                    changes.put(key, 1L);
                }
            }
            case UPDATE -> {
                if (current != null) {
                    op.getUpdate().applyTo(current);
                    long revno = Documents.revno(current) + 1;
                    current.put(Documents.REVNO, revno);
                    changes.put(key, revno);
                }
            }
            case REMOVE -> {
                if (current != null) {
                    docs.remove(op.getId());
                    changes.put(key, -1L);
                }
            }
        }
    }

    private TreeMap<String, Map<String, Object>> collection(String name) {
        return collections.computeIfAbsent(name, k -> new TreeMap<>());
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException("Document store " + name + " is closed");
        }
    }

    @Override
    public void addChangeListener(ChangeListener listener) {
        listeners.add(listener);
    }

    @Override
    public boolean isConnected() {
        return open;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void close() {
        open = false;
        log.debug("Document store {} closed", name);
    }
}
