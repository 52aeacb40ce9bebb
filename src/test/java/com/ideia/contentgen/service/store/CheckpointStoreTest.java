package com.ideia.contentgen.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.model.CategoryCheckpoint;
import com.ideia.contentgen.model.CheckpointSnapshot;
import com.ideia.contentgen.model.ContentKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class CheckpointStoreTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void recordBatchPersistsCountersAndSurvivesReload() {
        Path path = dir.resolve(".checkpoints.json");
        CheckpointStore store = new CheckpointStore(path, mapper, false);
        store.load();
        store.recordBatch("ciencia", ContentKind.CURIOSITIES);
        store.recordBatch("ciencia", ContentKind.CURIOSITIES);
        store.recordBatch("ciencia", ContentKind.QUIZZES);

        CheckpointStore reloaded = new CheckpointStore(path, mapper, false);
        reloaded.load();
        CategoryCheckpoint cp = reloaded.get("ciencia");
        assertEquals(2, cp.getCuriositiesBatchesProcessed());
        assertEquals(1, cp.getQuizzesBatchesProcessed());
        assertNotNull(cp.getLastRunAt());
        assertNotNull(reloaded.getUpdatedAt());
        assertEquals(0, reloaded.get("arte").batchesProcessed(ContentKind.QUIZZES));
    }

    @Test
    public void getReturnsACopy() {
        CheckpointStore store = new CheckpointStore(dir.resolve(".checkpoints.json"), mapper, false);
        store.load();
        store.recordBatch("arte", ContentKind.QUIZZES);
        store.get("arte").setQuizzesBatchesProcessed(99);
        assertEquals(1, store.get("arte").getQuizzesBatchesProcessed());
    }

    @Test
    public void concurrentWorkersDoNotLoseUpdates() throws Exception {
        Path path = dir.resolve(".checkpoints.json");
        CheckpointStore store = new CheckpointStore(path, mapper, false);
        store.load();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String category = i % 2 == 0 ? "ciencia" : "arte";
                futures.add(pool.submit(() -> store.recordBatch(category, ContentKind.CURIOSITIES)));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }
        CheckpointSnapshot snap = mapper.readValue(path.toFile(), CheckpointSnapshot.class);
        assertEquals(20, snap.getCategories().get("ciencia").getCuriositiesBatchesProcessed());
        assertEquals(20, snap.getCategories().get("arte").getCuriositiesBatchesProcessed());
    }

    @Test
    public void readOnlyStoreCountsInMemoryOnly() {
        Path path = dir.resolve(".checkpoints.json");
        CheckpointStore store = new CheckpointStore(path, mapper, true);
        store.load();
        store.recordBatch("ciencia", ContentKind.QUIZZES);
        assertEquals(1, store.get("ciencia").getQuizzesBatchesProcessed());
        assertFalse(Files.exists(path));
    }

    @Test
    public void saveBeforeLoadLeavesTheFileAlone() throws Exception {
        Path path = dir.resolve(".checkpoints.json");
        String original = "{\"categories\":{\"ciencia\":{\"curiositiesBatchesProcessed\":7}}}";
        Files.writeString(path, original);

        CheckpointStore store = new CheckpointStore(path, mapper, false);
        store.save();
        assertEquals(original, Files.readString(path));
        assertThrows(IllegalStateException.class, () -> store.recordBatch("ciencia", ContentKind.CURIOSITIES));
    }

    @Test
    public void unreadableFileKeepsCountersAndIsNeverOverwritten() throws Exception {
        Path path = dir.resolve(".checkpoints.json");
        CheckpointStore store = new CheckpointStore(path, mapper, false);
        store.load();
        store.recordBatch("ciencia", ContentKind.CURIOSITIES);

        Files.writeString(path, "{ not json");
        assertThrows(ContentPersistenceException.class, store::load);
        assertEquals(1, store.get("ciencia").getCuriositiesBatchesProcessed());

        CheckpointStore fresh = new CheckpointStore(path, mapper, false);
        assertThrows(ContentPersistenceException.class, fresh::load);
        assertFalse(fresh.isLoaded());
        fresh.save();
        assertEquals("{ not json", Files.readString(path));
    }
}
