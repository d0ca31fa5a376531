package com.di.taskpilot.learner;

/**
 * Persistence for the learner's knowledge. The whole document is read at startup and rewritten on each mutation.
 */
public interface KnowledgeStore {

    /**
     * @return the stored snapshot, or {@link KnowledgeSnapshot#empty()} when nothing has been saved yet
     * @throws KnowledgeStoreException when stored data exists but cannot be read
     */
    KnowledgeSnapshot load();

    /**
     * @throws KnowledgeStoreException when the snapshot cannot be written
     */
    void save(KnowledgeSnapshot snapshot);
}
