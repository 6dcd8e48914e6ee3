package com.cluster.state.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface to the shared document database.
 * Abstracts the underlying engine: any store that can read documents by id,
 * filter a collection, and apply an assert-then-mutate batch atomically can
 * back the state layer.
 */
public interface DocumentStore extends AutoCloseable {

    /**
     * Reads one document.
     *
     * @param collection the collection name
     * @param id         the document id
     * @return a private copy of the document, or empty if it does not exist
     */
    Optional<Map<String, Object>> findOne(String collection, String id);

    /**
     * Returns copies of every document in {@code collection} matching {@code filter},
     * ordered by id.
     */
    List<Map<String, Object>> findMany(String collection, Condition filter);

    /**
     * Returns every document in a collection, ordered by id.
     */
    default List<Map<String, Object>> findAll(String collection) {
        return findMany(collection, Condition.always());
    }

    /**
     * Counts documents in {@code collection} matching {@code filter}.
     */
    default int count(String collection, Condition filter) {
        return findMany(collection, filter).size();
    }

    /**
     * Applies a batch atomically. Every assertion is evaluated against the state
     * before the batch; if any fails nothing is written and the batch aborts.
     * Otherwise all mutations are applied in order and each touched document's
     * {@value Documents#REVNO} is incremented.
     *
     * @param ops the operations to apply
     * @return whether the batch was applied or aborted
     */
    BatchOutcome runAtomicBatch(List<TxnOp> ops);

    /**
     * Registers a listener notified after each applied mutation.
     */
    void addChangeListener(ChangeListener listener);

    /**
     * Checks if the store is reachable.
     */
    boolean isConnected();

    /**
     * Gets the name of the database in use.
     */
    String getName();

    @Override
    void close();
}
