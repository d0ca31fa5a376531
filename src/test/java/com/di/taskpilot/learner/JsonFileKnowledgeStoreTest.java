package com.di.taskpilot.learner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonFileKnowledgeStore Tests")
class JsonFileKnowledgeStoreTest {

    @TempDir
    Path tempDir;

    private Path file;
    private JsonFileKnowledgeStore store;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("nested").resolve("knowledge.json");
        store = new JsonFileKnowledgeStore(file, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    @DisplayName("Should return an empty snapshot when no file exists")
    void testLoad_Missing() {
        KnowledgeSnapshot snapshot = store.load();
        assertTrue(snapshot.patterns().isEmpty());
        assertTrue(snapshot.adaptationHistory().isEmpty());
    }

    @Test
    @DisplayName("Should write the snapshot and read it back, creating parent directories")
    void testSaveThenLoad() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        Pattern pattern = new Pattern("sim", "A", 7, 0.9, new ResourceProfile(0.3, 150.0, 8.0, 7), now);
        KnowledgeSnapshot snapshot = new KnowledgeSnapshot(
                Map.of(pattern.key(), pattern),
                List.of(new AdaptationRecord("t1", true, "latency_spike", now)),
                now);

        store.save(snapshot);

        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling("knowledge.json.tmp")));
        KnowledgeSnapshot loaded = store.load();
        assertEquals(pattern, loaded.patterns().get("sim:A"));
        assertEquals("latency_spike", loaded.adaptationHistory().get(0).reason());
        assertEquals(now, loaded.lastSaved());
    }

    @Test
    @DisplayName("Should replace the previous document on save")
    void testSave_Overwrites() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        Pattern a = Pattern.create("sim", "A", now);
        Pattern b = Pattern.create("sim", "B", now);
        store.save(new KnowledgeSnapshot(Map.of(a.key(), a), List.of(), now));
        store.save(new KnowledgeSnapshot(Map.of(b.key(), b), List.of(), now));

        assertEquals(Map.of(b.key(), b), store.load().patterns());
    }

    @Test
    @DisplayName("Should raise KnowledgeStoreException for a corrupt file")
    void testLoad_Corrupt() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");
        assertThrows(KnowledgeStoreException.class, () -> store.load());
    }

    @Test
    @DisplayName("Should keep the document in step with the learner under concurrent executions")
    void testConcurrentLearnerWrites() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        ContextLearner learner = new ContextLearner(store, new LearnerProperties(), clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                futures.add(pool.submit(() -> learner.recordExecution("sim", "A", null, true)));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(400L, learner.pattern("sim", "A").orElseThrow().executionCount());
        assertFalse(Files.exists(file.resolveSibling("knowledge.json.tmp")));
        JsonFileKnowledgeStore reopened = new JsonFileKnowledgeStore(file, new ObjectMapper().findAndRegisterModules());
        assertEquals(400L, reopened.load().patterns().get("sim:A").executionCount());
    }
}
