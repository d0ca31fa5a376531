package com.di.taskpilot.learner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores the snapshot as one JSON document. Writes go to a sibling temp file that is then moved over the
 * target, so a crash mid-write leaves the previous document intact. Saves are serialized per store.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "taskpilot.learner.store", havingValue = "file", matchIfMissing = true)
public class JsonFileKnowledgeStore implements KnowledgeStore {

    private final Path file;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileKnowledgeStore(LearnerProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getKnowledgeFile()), objectMapper);
    }

    public JsonFileKnowledgeStore(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public KnowledgeSnapshot load() {
        if (!Files.exists(file)) {
            log.debug("[STORE] No knowledge file at {}", file);
            return KnowledgeSnapshot.empty();
        }
        try {
            KnowledgeSnapshot snapshot = objectMapper.readValue(file.toFile(), KnowledgeSnapshot.class);
            log.info("[STORE] Loaded {} pattern(s) from {}", snapshot.patterns().size(), file);
            return snapshot;
        } catch (IOException e) {
            throw new KnowledgeStoreException("Cannot read knowledge file " + file, e);
        }
    }

    @Override
    public synchronized void save(KnowledgeSnapshot snapshot) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new KnowledgeStoreException("Cannot write knowledge file " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
