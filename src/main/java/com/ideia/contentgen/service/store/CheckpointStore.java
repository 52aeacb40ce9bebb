package com.ideia.contentgen.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.model.CategoryCheckpoint;
import com.ideia.contentgen.model.CheckpointSnapshot;
import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.util.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-category batch counters persisted as one JSON document. Every mutation rewrites the whole
 * document atomically; mutations from concurrent workers are serialized.
 */
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path path;
    private final ObjectMapper mapper;
    private final boolean readOnly;
    private final Map<String, CategoryCheckpoint> checkpoints = new LinkedHashMap<>();
    private String updatedAt;
    private boolean loaded = false;

    public CheckpointStore(Path path, ObjectMapper mapper, boolean readOnly) {
        this.path = path;
        this.mapper = mapper;
        this.readOnly = readOnly;
    }

    /**
     * Replaces the in-memory counters with the file contents. On a read or parse error the counters
     * stay untouched; until a load has succeeded {@link #save()} writes nothing.
     */
    public synchronized void load() {
        CheckpointSnapshot snap = null;
        if (Files.exists(path)) {
            try {
                String txt = Files.readString(path);
                if (!txt.isBlank()) snap = mapper.readValue(txt, CheckpointSnapshot.class);
            } catch (IOException e) {
                throw new ContentPersistenceException("Cannot read checkpoints " + path, e);
            }
        }
        checkpoints.clear();
        if (snap != null) {
            if (snap.getCategories() != null) checkpoints.putAll(snap.getCategories());
            updatedAt = snap.getUpdatedAt();
            log.info("Loaded checkpoints for {} categories (last write {})", checkpoints.size(), updatedAt);
        }
        loaded = true;
    }

    public synchronized boolean isLoaded() {
        return loaded;
    }

    /** Copy of the stored counters; a fresh zeroed record for unknown categories. */
    public synchronized CategoryCheckpoint get(String categoryId) {
        CategoryCheckpoint cp = checkpoints.get(categoryId);
        return cp == null ? new CategoryCheckpoint() : cp.copy();
    }

    /** Counts one committed batch for the category and kind, then persists. */
    public synchronized CategoryCheckpoint recordBatch(String categoryId, ContentKind kind) {
        if (!loaded) throw new IllegalStateException("Checkpoints recorded before load()");
        CategoryCheckpoint cp = checkpoints.computeIfAbsent(categoryId, k -> new CategoryCheckpoint());
        if (kind == ContentKind.QUIZZES) {
            cp.setQuizzesBatchesProcessed(cp.getQuizzesBatchesProcessed() + 1);
        } else {
            cp.setCuriositiesBatchesProcessed(cp.getCuriositiesBatchesProcessed() + 1);
        }
        cp.setLastRunAt(Instant.now().toString());
        save();
        return cp.copy();
    }

    /** Persists the counters. Does nothing until {@link #load()} has succeeded once. */
    public synchronized void save() {
        if (!loaded) {
            log.debug("Checkpoints were never loaded; leaving {} untouched", path);
            return;
        }
        updatedAt = Instant.now().toString();
        if (readOnly) {
            log.debug("[dry-run] would write checkpoints to {}", path);
            return;
        }
        CheckpointSnapshot snap = new CheckpointSnapshot();
        snap.setUpdatedAt(updatedAt);
        snap.setCategories(new LinkedHashMap<>(checkpoints));
        try {
            JsonFiles.writeAtomically(mapper, path, snap);
        } catch (IOException e) {
            throw new ContentPersistenceException("Cannot write checkpoints " + path, e);
        }
    }

    public synchronized String getUpdatedAt() {
        return updatedAt;
    }
}
