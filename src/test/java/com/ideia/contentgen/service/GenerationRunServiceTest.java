package com.ideia.contentgen.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.config.AppProperties;
import com.ideia.contentgen.dto.GenerationDtos;
import com.ideia.contentgen.dto.GenerationDtos.TaskStatus;
import com.ideia.contentgen.model.Category;
import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.service.dedup.Deduplicator;
import com.ideia.contentgen.service.generation.PromptBuilder;
import com.ideia.contentgen.service.parsing.ResponseParser;
import com.ideia.contentgen.service.store.CheckpointStore;
import com.ideia.contentgen.service.store.ContentPersistenceException;
import com.ideia.contentgen.service.store.ContentStore;
import com.ideia.contentgen.service.store.HashIndex;
import com.ideia.contentgen.service.store.LockConflictException;
import com.ideia.contentgen.service.store.LockManager;
import com.ideia.contentgen.service.validation.ContentValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static com.ideia.contentgen.TestContent.QUESTIONS;
import static com.ideia.contentgen.TestContent.TITLES;
import static com.ideia.contentgen.TestContent.curiosity;
import static com.ideia.contentgen.TestContent.curiosityArray;
import static com.ideia.contentgen.TestContent.quizArray;
import static org.junit.jupiter.api.Assertions.*;

public class GenerationRunServiceTest {

    @TempDir
    Path root;

    private final ObjectMapper mapper = new ObjectMapper();
    private AppProperties props;
    private Path dataDir;
    private Path historyDir;
    private FakeGenerationClient client;
    private final AtomicInteger nextTitle = new AtomicInteger();
    private final AtomicInteger nextQuestion = new AtomicInteger();

    private ContentStore store;
    private String failingCategory;

    @BeforeEach
    void setUp() throws IOException {
        dataDir = root.resolve("data");
        historyDir = root.resolve("history");
        Files.createDirectories(dataDir);
        Path catalog = root.resolve("categories.json");
        mapper.writeValue(catalog.toFile(), List.of(new Category("ciencia", "Ciência"), new Category("arte", "Arte")));

        props = new AppProperties();
        props.setDataDir(dataDir.toString());
        props.setCatalogPath(catalog.toString());
        props.setRunHistoryDir(historyDir.toString());
        props.setCuriositiesTarget(2);
        props.setQuizzesTarget(1);
        props.setConcurrency(2);
        props.setApiCallDelayMs(0);
        props.setMaxConsecutiveFailedBatches(2);

        store = new ContentStore(dataDir, mapper);
        client = new FakeGenerationClient().generator((kind, count) -> kind == ContentKind.QUIZZES
                ? quizArray(take(QUESTIONS, nextQuestion, count))
                : curiosityArray(take(TITLES, nextTitle, count)));
    }

    private static List<String> take(List<String> pool, AtomicInteger cursor, int count) {
        int from = Math.min(cursor.getAndAdd(count), pool.size());
        return pool.subList(from, Math.min(from + count, pool.size()));
    }

    private GenerationRunService service() {
        boolean dryRun = props.isDryRun();
        HashIndex hashIndex = new HashIndex(dataDir.resolve(".hash-index.json"), mapper, 200, dryRun);
        CheckpointStore checkpoints = new CheckpointStore(dataDir.resolve(".checkpoints.json"), mapper, dryRun);
        CategoryTaskOrchestrator orchestrator = new CategoryTaskOrchestrator(store, hashIndex, checkpoints, client,
                new ResponseParser(), new ContentValidator(), new Deduplicator(hashIndex, 0.82), new PromptBuilder(),
                props, ms -> {}) {
            @Override
            public GenerationDtos.TaskReport run(CategoryTask task) {
                if (task.category().getId().equals(failingCategory)) {
                    throw new ContentPersistenceException("disk full", new IOException("No space left on device"));
                }
                return super.run(task);
            }
        };
        return new GenerationRunService(props, new CatalogService(props, mapper), store, hashIndex, checkpoints,
                new LockManager(dataDir.resolve(".generator.lock"), mapper), orchestrator, client, mapper);
    }

    private long historyFiles() throws IOException {
        if (!Files.isDirectory(historyDir)) return 0;
        try (Stream<Path> files = Files.list(historyDir)) {
            return files.count();
        }
    }

    @Test
    public void fullRunFillsEveryCategoryThenFlushesAndUnlocks() throws Exception {
        GenerationRunService service = service();
        GenerationDtos.RunReport report = service.run();

        assertEquals(2, report.getCategories());
        assertEquals(6, report.getGenerated_total());
        assertEquals(0, report.getFailed_tasks());
        assertEquals(4, report.getTasks().size(), "main pass only; equalization found nothing missing");
        assertEquals(2, store.read(ContentKind.CURIOSITIES, "ciencia").size());
        assertEquals(2, store.read(ContentKind.CURIOSITIES, "arte").size());
        assertEquals(1, store.read(ContentKind.QUIZZES, "arte").size());

        assertTrue(service.isShutdown());
        assertFalse(Files.exists(dataDir.resolve(".generator.lock")));
        assertTrue(Files.exists(dataDir.resolve(".hash-index.json")));
        assertTrue(Files.exists(dataDir.resolve(".checkpoints.json")));
        assertEquals(1, historyFiles());
    }

    @Test
    public void secondRunIsANoOp() {
        service().run();
        int calls = client.calls();

        GenerationDtos.RunReport again = service().run();
        assertEquals(0, again.getGenerated_total());
        assertEquals(calls, client.calls());
        assertTrue(again.getTasks().stream().allMatch(t -> t.getStatus() == TaskStatus.SKIPPED));
    }

    @Test
    public void lockConflictFailsBeforeAnyModelCall() throws Exception {
        Path lock = dataDir.resolve(".generator.lock");
        Files.writeString(lock, "{\"ownerPid\": 4242, \"startedAt\": \"2024-01-01T00:00:00Z\"}");

        GenerationRunService service = service();
        assertThrows(LockConflictException.class, service::run);
        assertEquals(0, client.calls());
        assertTrue(Files.exists(lock));
        assertTrue(Files.readString(lock).contains("4242"));
        assertFalse(Files.exists(dataDir.resolve("curiosities")));
        assertEquals(0, historyFiles());
    }

    @Test
    public void forceLockTakesOverAndReleasesAtTheEnd() throws Exception {
        Path lock = dataDir.resolve(".generator.lock");
        Files.writeString(lock, "{\"ownerPid\": 4242}");
        props.setForceLock(true);

        service().run();
        assertTrue(client.calls() > 0);
        assertFalse(Files.exists(lock));
    }

    @Test
    public void failedTaskFailsTheRunButKeepsOtherProgress() {
        failingCategory = "arte";
        GenerationRunService service = service();

        PipelineException e = assertThrows(PipelineException.class, service::run);
        assertTrue(e.getMessage().contains("arte"));
        assertEquals(2, store.read(ContentKind.CURIOSITIES, "ciencia").size());
        assertEquals(1, store.read(ContentKind.QUIZZES, "ciencia").size());
        assertFalse(Files.exists(dataDir.resolve(".generator.lock")));
        assertTrue(service.isShutdown());
    }

    @Test
    public void equalizeOnlyTopsUpWithoutAMainPass() {
        props.setEqualizeOnly(true);
        props.setKinds(List.of("curiosities"));
        store.write(ContentKind.CURIOSITIES, "ciencia", List.of(curiosity("ciencia-1", "ciencia", "Registro antigo")));

        GenerationDtos.RunReport report = service().run();

        assertEquals(2, report.getTasks().size());
        assertTrue(report.getTasks().stream().allMatch(t -> "equalize".equals(t.getPass())));
        assertEquals(3, report.getGenerated_total());
        assertEquals(2, store.read(ContentKind.CURIOSITIES, "ciencia").size());
        assertEquals(2, store.read(ContentKind.CURIOSITIES, "arte").size());
        assertTrue(store.read(ContentKind.QUIZZES, "arte").isEmpty());
    }

    @Test
    public void categoryFiltersNarrowTheRun() {
        props.setCategories(List.of("ciencia", "arte"));
        props.setExcludeCategories(List.of("arte"));

        GenerationDtos.RunReport report = service().run();
        assertEquals(1, report.getCategories());
        assertTrue(report.getTasks().stream().allMatch(t -> "ciencia".equals(t.getCategoryId())));
        assertFalse(Files.exists(store.fileFor(ContentKind.CURIOSITIES, "arte")));
    }

    @Test
    public void orphanFilesAreRemovedButLegacyQuizNamesAreKept() {
        store.write(ContentKind.CURIOSITIES, "removida", List.of(curiosity("removida-1", "removida", "Registro antigo")));
        store.write(ContentKind.QUIZZES, "quiz-arte", List.of());

        service().run();
        assertFalse(Files.exists(store.fileFor(ContentKind.CURIOSITIES, "removida")));
        assertTrue(Files.exists(store.fileFor(ContentKind.QUIZZES, "quiz-arte")));
    }

    @Test
    public void dryRunCallsTheModelButWritesNothing() throws Exception {
        props.setDryRun(true);
        GenerationDtos.RunReport report = service().run();

        assertTrue(report.isDryRun());
        assertTrue(client.calls() > 0);
        assertEquals(6, report.getGenerated_total());
        try (Stream<Path> files = Files.list(dataDir)) {
            assertEquals(0, files.count());
        }
        assertEquals(0, historyFiles());
    }

    @Test
    public void shutdownRunsOnce() throws Exception {
        GenerationRunService service = service();
        service.run();
        assertTrue(service.isShutdown());
        Path checkpoints = dataDir.resolve(".checkpoints.json");
        assertTrue(Files.exists(checkpoints));

        Files.delete(checkpoints);
        service.shutdown();
        assertFalse(Files.exists(checkpoints), "second call must not save again");
    }

    @Test
    public void startupFailureKeepsExistingCheckpoints() throws Exception {
        Path checkpoints = dataDir.resolve(".checkpoints.json");
        String saved = "{\"updatedAt\":\"2024-01-01T00:00:00Z\",\"categories\":"
                + "{\"ciencia\":{\"curiositiesBatchesProcessed\":7,\"quizzesBatchesProcessed\":3}}}";
        Files.writeString(checkpoints, saved);
        Files.writeString(dataDir.resolve("curiosities"), "not a directory");

        GenerationRunService service = service();
        assertThrows(ContentPersistenceException.class, service::run);

        assertTrue(service.isShutdown());
        assertEquals(saved, Files.readString(checkpoints));
        assertFalse(Files.exists(dataDir.resolve(".generator.lock")));
        assertEquals(0, client.calls());
    }
}
