package com.cluster.state.settings;

import com.cluster.state.errors.NotFoundException;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.store.Documents;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;
import com.cluster.state.txn.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A key/value settings document with local edits.
 *
 * <p>Edits accumulate in memory until {@link #write()}, which stores only the
 * difference against the last read. The write asserts the revision that was
 * read; if another writer got in first, the same difference is re-applied on
 * top of the fresh document, so concurrent writers touching different keys
 * both succeed. Not safe for use by multiple threads.</p>
 */
public class Settings {

    private static final Logger log = LoggerFactory.getLogger(Settings.class);

    static final String VALUES = "settings";

    private final DocumentStore store;
    private final TransactionRunner runner;
    private final String key;
    private Map<String, Object> disk;
    private Map<String, Object> core;
    private long revno;

    Settings(DocumentStore store, TransactionRunner runner, String key, Map<String, Object> document) {
        this.store = store;
        this.runner = runner;
        this.key = key;
        load(document);
    }

    public String getKey() {
        return key;
    }

    public Object get(String name) {
        return core.get(name);
    }

    public boolean containsKey(String name) {
        return core.containsKey(name);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeSet<>(core.keySet()));
    }

    /**
     * Returns a copy of the current values, including unwritten edits.
     */
    public Map<String, Object> map() {
        return Documents.copy(core);
    }

    public void set(String name, Object value) {
        core.put(name, Documents.normalize(value));
    }

    /**
     * Sets every entry of {@code values}.
     */
    public void update(Map<String, ?> values) {
        values.forEach(this::set);
    }

    public void delete(String name) {
        core.remove(name);
    }

    /**
     * Reloads from the store, discarding unwritten edits.
     *
     * @throws NotFoundException if the document no longer exists
     */
    public void read() {
        Map<String, Object> document = store.findOne(CollectionNames.SETTINGS, key)
                .orElseThrow(() -> new NotFoundException("settings " + key + " not found"));
        load(document);
    }

    /**
     * Writes the local edits and returns the changes made, ordered by key.
     * Keys whose value did not change are not reported.
     *
     * @throws NotFoundException if the document was removed
     */
    public List<ItemChange> write() {
        List<ItemChange> changes = diff(disk, core);
        if (changes.isEmpty()) {
            return changes;
        }
        Map<String, Object> cachedBase = Documents.copy(disk);
        long cachedRevno = revno;
        AtomicReference<Map<String, Object>> written = new AtomicReference<>();
        AtomicReference<Long> writtenRevno = new AtomicReference<>();
        runner.run("write settings " + key, attempt -> {
            Map<String, Object> base;
            long expectedRevno;
            if (attempt == 0) {
                base = cachedBase;
                expectedRevno = cachedRevno;
            } else {
                Map<String, Object> fresh = store.findOne(CollectionNames.SETTINGS, key)
                        .orElseThrow(() -> new NotFoundException("settings " + key + " not found"));
                base = values(fresh);
                expectedRevno = Documents.revno(fresh);
                log.debug("Rebasing settings {} onto revision {}", key, expectedRevno);
            }
            Map<String, Object> next = apply(base, changes);
            written.set(next);
            writtenRevno.set(expectedRevno + 1);
            return List.of(TxnOp.on(CollectionNames.SETTINGS, key)
                    .assertThat(Condition.revno(expectedRevno))
                    .update(new Update().set(VALUES, next)));
        });
        disk = Documents.copy(written.get());
        core = Documents.copy(written.get());
        revno = writtenRevno.get();
        return changes;
    }

    private void load(Map<String, Object> document) {
        this.disk = values(document);
        this.core = Documents.copy(disk);
        this.revno = Documents.revno(document);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> values(Map<String, Object> document) {
        Object values = document.get(VALUES);
        if (values instanceof Map<?, ?> m) {
            return Documents.copy((Map<String, Object>) m);
        }
        return new LinkedHashMap<>();
    }

    static List<ItemChange> diff(Map<String, Object> before, Map<String, Object> after) {
        List<ItemChange> changes = new ArrayList<>();
        for (Map.Entry<String, Object> entry : after.entrySet()) {
            if (!before.containsKey(entry.getKey())) {
                changes.add(ItemChange.added(entry.getKey(), entry.getValue()));
            } else if (!Documents.valuesEqual(before.get(entry.getKey()), entry.getValue())) {
                changes.add(ItemChange.modified(entry.getKey(), before.get(entry.getKey()), entry.getValue()));
            }
        }
        for (Map.Entry<String, Object> entry : before.entrySet()) {
            if (!after.containsKey(entry.getKey())) {
                changes.add(ItemChange.deleted(entry.getKey(), entry.getValue()));
            }
        }
        Collections.sort(changes);
        return changes;
    }

    private static Map<String, Object> apply(Map<String, Object> base, List<ItemChange> changes) {
        Map<String, Object> result = Documents.copy(base);
        for (ItemChange change : changes) {
            if (change.type() == ItemChange.Type.DELETED) {
                result.remove(change.key());
            } else {
                result.put(change.key(), Documents.copyValue(change.newValue()));
            }
        }
        return result;
    }
}
