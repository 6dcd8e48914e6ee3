package com.cluster.state.settings;

import com.cluster.state.errors.AlreadyExistsException;
import com.cluster.state.errors.NotFoundException;
import com.cluster.state.store.BatchOutcome;
import com.cluster.state.store.CollectionNames;
import com.cluster.state.store.Condition;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.store.Documents;
import com.cluster.state.store.TxnOp;
import com.cluster.state.store.Update;
import com.cluster.state.txn.TransactionRunner;

import java.util.List;
import java.util.Map;

/**
 * Entry point for settings documents, and the ops other entities use to
 * create and remove them inside their own transactions.
 */
public class SettingsCollection {

    private final DocumentStore store;
    private final TransactionRunner runner;

    public SettingsCollection(DocumentStore store, TransactionRunner runner) {
        this.store = store;
        this.runner = runner;
    }

    /**
     * Creates a settings document.
     *
     * @throws AlreadyExistsException if one already exists under {@code key}
     */
    public Settings create(String key, Map<String, ?> values) {
        BatchOutcome outcome = runner.runOnce("create settings " + key, List.of(createOp(key, values)));
        if (outcome == BatchOutcome.ABORTED) {
            throw new AlreadyExistsException("cannot overwrite existing settings " + key);
        }
        return read(key);
    }

    /**
     * @throws NotFoundException if there is no document under {@code key}
     */
    public Settings read(String key) {
        Map<String, Object> document = store.findOne(CollectionNames.SETTINGS, key)
                .orElseThrow(() -> new NotFoundException("settings " + key + " not found"));
        return new Settings(store, runner, key, document);
    }

    /**
     * @throws NotFoundException if there is no document under {@code key}
     */
    public void remove(String key) {
        BatchOutcome outcome = runner.runOnce("remove settings " + key, List.of(TxnOp.on(CollectionNames.SETTINGS, key)
                .assertThat(Condition.docExists())
                .remove()));
        if (outcome == BatchOutcome.ABORTED) {
            throw new NotFoundException("settings " + key + " not found");
        }
    }

    /**
     * Builds the insert of a new settings document, asserting none exists.
     */
    public static TxnOp createOp(String key, Map<String, ?> values) {
        @SuppressWarnings("unchecked")
        Map<String, Object> copy = (Map<String, Object>) Documents.normalize(values);
        return TxnOp.on(CollectionNames.SETTINGS, key)
                .assertThat(Condition.docMissing())
                .insert(Map.of(Settings.VALUES, copy));
    }

    /**
     * Builds a replacement of all values of an existing settings document.
     */
    public static TxnOp replaceOp(String key, Map<String, ?> values) {
        return TxnOp.on(CollectionNames.SETTINGS, key)
                .assertThat(Condition.docExists())
                .update(new Update().set(Settings.VALUES, values));
    }

    /**
     * Builds an unconditional removal of a settings document.
     */
    public static TxnOp removeOp(String key) {
        return TxnOp.on(CollectionNames.SETTINGS, key).remove();
    }
}
