package com.cluster.state.store;

import java.util.Map;
import java.util.Objects;

/**
 * A single step of an atomic batch: an optional assertion on one document plus
 * at most one mutation (insert, update or remove) of that same document.
 *
 * <pre>
 * TxnOp op = TxnOp.on("units", "wordpress/0")
 *         .assertThat(Condition.eq("life", Life.ALIVE))
 *         .update(new Update().set("life", Life.DYING));
 * </pre>
 *
 * <p>Insert follows the store's semantics: inserting a document that already
 * exists is silently skipped, so callers assert {@link Condition#docMissing()}
 * when they need to detect duplicates.</p>
 */
public final class TxnOp {

    public enum Kind { ASSERT, INSERT, UPDATE, REMOVE }

    private final String collection;
    private final String id;
    private final Condition assertion;
    private final Kind kind;
    private final Map<String, Object> insert;
    private final Update update;

    private TxnOp(String collection, String id, Condition assertion, Kind kind,
                  Map<String, Object> insert, Update update) {
        this.collection = collection;
        this.id = id;
        this.assertion = assertion;
        this.kind = kind;
        this.insert = insert;
        this.update = update;
    }

    public static Builder on(String collection, String id) {
        return new Builder(collection, id);
    }

    public String getCollection() {
        return collection;
    }

    public String getId() {
        return id;
    }

    /**
     * Returns the assertion, or {@code null} when the op is unconditional.
     */
    public Condition getAssertion() {
        return assertion;
    }

    public Kind getKind() {
        return kind;
    }

    public Map<String, Object> getInsert() {
        return insert;
    }

    public Update getUpdate() {
        return update;
    }

    @Override
    public String toString() {
        return kind + " " + collection + "/" + id + (assertion != null ? " assert " + assertion : "");
    }

    public static class Builder {
        private final String collection;
        private final String id;
        private Condition assertion;

        private Builder(String collection, String id) {
            this.collection = Objects.requireNonNull(collection, "collection is required");
            this.id = Objects.requireNonNull(id, "id is required");
        }

        public Builder assertThat(Condition condition) {
            this.assertion = condition;
            return this;
        }

        /**
         * Finishes an op that only asserts.
         */
        public TxnOp check() {
            Objects.requireNonNull(assertion, "an assert-only op needs an assertion");
            return new TxnOp(collection, id, assertion, Kind.ASSERT, null, null);
        }

        public TxnOp insert(Map<String, Object> document) {
            Map<String, Object> doc = Documents.copy(Documents.normalizeDocument(document));
            return new TxnOp(collection, id, assertion, Kind.INSERT, doc, null);
        }

        public TxnOp update(Update update) {
            return new TxnOp(collection, id, assertion, Kind.UPDATE, null, update);
        }

        public TxnOp remove() {
            return new TxnOp(collection, id, assertion, Kind.REMOVE, null, null);
        }
    }
}
