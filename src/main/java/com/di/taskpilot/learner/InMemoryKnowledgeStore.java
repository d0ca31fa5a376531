package com.di.taskpilot.learner;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the last saved snapshot in memory. Select with taskpilot.learner.store=memory.
 */
@Component
@ConditionalOnProperty(name = "taskpilot.learner.store", havingValue = "memory")
public class InMemoryKnowledgeStore implements KnowledgeStore {

    private final AtomicReference<KnowledgeSnapshot> snapshot = new AtomicReference<>(KnowledgeSnapshot.empty());

    @Override
    public KnowledgeSnapshot load() {
        return snapshot.get();
    }

    @Override
    public void save(KnowledgeSnapshot snapshot) {
        if (snapshot != null) this.snapshot.set(snapshot);
    }
}
