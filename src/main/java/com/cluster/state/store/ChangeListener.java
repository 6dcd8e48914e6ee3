package com.cluster.state.store;

/**
 * Listener for document changes. Watchers use it to learn that a document's
 * revision moved without polling.
 */
public interface ChangeListener {

    /**
     * Called after a batch that touched the document was applied.
     *
     * @param collection the collection of the changed document
     * @param id         the document id
     * @param revno      the new revision, or {@code -1} if the document was removed
     */
    void onChange(String collection, String id, long revno);
}
