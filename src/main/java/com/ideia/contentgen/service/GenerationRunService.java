package com.ideia.contentgen.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.config.AppProperties;
import com.ideia.contentgen.dto.GenerationDtos;
import com.ideia.contentgen.dto.GenerationDtos.TaskStatus;
import com.ideia.contentgen.model.Category;
import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.service.generation.GenerationClient;
import com.ideia.contentgen.service.store.CheckpointStore;
import com.ideia.contentgen.service.store.ContentStore;
import com.ideia.contentgen.service.store.HashIndex;
import com.ideia.contentgen.service.store.LockManager;
import com.ideia.contentgen.util.TokenAccounting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Drives one generation run over the selected categories.
 *
 * <p>Order of work: lock, checkpoints, catalog, orphan cleanup, hash seeding, main pass,
 * equalization pass, report. Every exit path, the JVM shutdown hook included, goes through
 * {@link #shutdown()}, which flushes the hash index, saves checkpoints and releases the lock once.
 */
@Service
public class GenerationRunService {
    private static final Logger log = LoggerFactory.getLogger(GenerationRunService.class);

    private final AppProperties appProperties;
    private final CatalogService catalogService;
    private final ContentStore contentStore;
    private final HashIndex hashIndex;
    private final CheckpointStore checkpointStore;
    private final LockManager lockManager;
    private final CategoryTaskOrchestrator orchestrator;
    private final GenerationClient generationClient;
    private final ObjectMapper mapper;

    private final AtomicBoolean shutdownDone = new AtomicBoolean(false);
    private Thread shutdownHook;

    public GenerationRunService(AppProperties appProperties,
                                CatalogService catalogService,
                                ContentStore contentStore,
                                HashIndex hashIndex,
                                CheckpointStore checkpointStore,
                                LockManager lockManager,
                                CategoryTaskOrchestrator orchestrator,
                                GenerationClient generationClient,
                                ObjectMapper mapper) {
        this.appProperties = appProperties;
        this.catalogService = catalogService;
        this.contentStore = contentStore;
        this.hashIndex = hashIndex;
        this.checkpointStore = checkpointStore;
        this.lockManager = lockManager;
        this.orchestrator = orchestrator;
        this.generationClient = generationClient;
        this.mapper = mapper;
    }

    /**
     * Runs the whole pipeline.
     *
     * @throws com.ideia.contentgen.service.store.LockConflictException when another run holds the lock
     * @throws PipelineException when one or more tasks failed; their committed progress is kept
     */
    public GenerationDtos.RunReport run() {
        boolean dryRun = appProperties.isDryRun();
        lockManager.acquire(appProperties.isForceLock(), generationClient.primaryModel(), dryRun);
        registerShutdownHook();

        GenerationDtos.RunReport report = new GenerationDtos.RunReport();
        report.setStartedAt(Instant.now().toString());
        report.setDryRun(dryRun);
        report.setModel(generationClient.primaryModel());
        TokenAccounting.reset();

        List<GenerationDtos.TaskReport> results = new ArrayList<>();
        try {
            if (dryRun) {
                log.info("[dry-run] no file under {} will be written", contentStore.getDataDir());
            } else {
                contentStore.ensureDirectories();
            }
            checkpointStore.load();

            List<Category> catalog = catalogService.loadAll();
            List<Category> selected = catalogService.selected(catalog);
            Set<ContentKind> kinds = selectedKinds();
            report.setCategories(selected.size());
            log.info("=== Generation run: {} of {} categories, kinds {}, concurrency {}{} ===",
                    selected.size(), catalog.size(), kinds, appProperties.getConcurrency(),
                    dryRun ? " [dry-run]" : "");

            if (appProperties.isCleanupOrphans()) {
                cleanupOrphans(catalog);
            }
            hashIndex.load(contentStore, catalog.stream().map(Category::getId).collect(Collectors.toList()));

            if (!appProperties.isEqualizeOnly()) {
                List<CategoryTask> main = new ArrayList<>();
                for (Category c : selected) {
                    for (ContentKind kind : kinds) {
                        main.add(CategoryTask.main(c, kind, targetFor(kind)));
                    }
                }
                results.addAll(runPool(main));
            }
            if (appProperties.isEqualize() || appProperties.isEqualizeOnly()) {
                results.addAll(equalize(selected, kinds, results));
            }
        } finally {
            shutdown();
        }

        report.setTasks(results);
        report.setGenerated_total(results.stream().mapToInt(GenerationDtos.TaskReport::getGenerated).sum());
        List<GenerationDtos.TaskReport> failed = results.stream()
                .filter(r -> r.getStatus() == TaskStatus.FAILED)
                .collect(Collectors.toList());
        report.setFailed_tasks(failed.size());
        report.setAi_usage_per_model(TokenAccounting.snapshot());
        report.setFinishedAt(Instant.now().toString());
        persistRunReport(report);

        if (!failed.isEmpty()) {
            String names = failed.stream()
                    .map(r -> r.getCategoryId() + "/" + r.getKind())
                    .collect(Collectors.joining(", "));
            throw new PipelineException(failed.size() + " task(s) failed: " + names);
        }
        return report;
    }

    /** Tasks run on a pool of {@code app.concurrency} workers; results come back in task order. */
    List<GenerationDtos.TaskReport> runPool(List<CategoryTask> tasks) {
        if (tasks.isEmpty()) return List.of();
        int concurrency = Math.max(1, appProperties.getConcurrency());
        List<GenerationDtos.TaskReport> out = Flux.fromIterable(tasks)
                .flatMapSequential(task -> Mono.fromCallable(() -> runSafely(task))
                        .subscribeOn(Schedulers.boundedElastic()), concurrency)
                .collectList()
                .block();
        return out == null ? List.of() : out;
    }

    /**
     * Second pass: every category below its target gets exactly the missing count. Runs per kind,
     * one kind after the other. A dry run counts what the main pass would have written.
     */
    private List<GenerationDtos.TaskReport> equalize(List<Category> selected, Set<ContentKind> kinds,
                                                     List<GenerationDtos.TaskReport> mainPass) {
        List<GenerationDtos.TaskReport> out = new ArrayList<>();
        for (ContentKind kind : kinds) {
            int target = targetFor(kind);
            log.info("=== Equalizing {} to {} per category ===", kind.getLabel(), target);
            List<CategoryTask> tasks = new ArrayList<>();
            for (Category c : selected) {
                int current = contentStore.read(kind, c.getId()).size();
                if (appProperties.isDryRun()) {
                    current += mainPass.stream()
                            .filter(r -> c.getId().equals(r.getCategoryId()) && kind.getLabel().equals(r.getKind()))
                            .mapToInt(GenerationDtos.TaskReport::getGenerated)
                            .sum();
                }
                int missing = target - current;
                if (missing <= 0) {
                    log.info("[{}/{}] {}/{}; nothing to equalize", c.getId(), kind.getLabel(), current, target);
                    continue;
                }
                tasks.add(CategoryTask.equalize(c, kind, target, missing));
            }
            out.addAll(runPool(tasks));
        }
        return out;
    }

    private GenerationDtos.TaskReport runSafely(CategoryTask task) {
        long started = System.currentTimeMillis();
        try {
            return orchestrator.run(task);
        } catch (RuntimeException e) {
            log.error("[{}] task aborted: {}", task.name(), e.getMessage(), e);
            GenerationDtos.TaskReport r = new GenerationDtos.TaskReport();
            r.setCategoryId(task.category().getId());
            r.setKind(task.kind().getLabel());
            r.setPass(task.isEqualization() ? "equalize" : "main");
            r.setTarget(task.target());
            r.setStatus(TaskStatus.FAILED);
            r.setMessage(e.getMessage());
            r.setDurationMs(System.currentTimeMillis() - started);
            return r;
        }
    }

    /**
     * Removes category files whose id is no longer in the catalog. Quiz files may still carry the
     * older {@code quiz-<id>} name; those are kept while {@code <id>} exists.
     */
    void cleanupOrphans(List<Category> catalog) {
        Set<String> ids = catalog.stream().map(Category::getId).collect(Collectors.toSet());
        for (ContentKind kind : ContentKind.values()) {
            for (String fileId : contentStore.listCategoryIds(kind)) {
                if (ids.contains(fileId)) continue;
                if (kind == ContentKind.QUIZZES && fileId.startsWith("quiz-")
                        && ids.contains(fileId.substring("quiz-".length()))) {
                    continue;
                }
                if (appProperties.isDryRun()) {
                    log.info("[dry-run] would remove orphan {}", contentStore.fileFor(kind, fileId));
                } else {
                    contentStore.delete(kind, fileId);
                }
            }
        }
    }

    /**
     * Flushes the hash index, saves checkpoints and releases the lock. Only the first call does
     * anything; later calls, from the shutdown hook or elsewhere, return immediately.
     */
    public void shutdown() {
        if (!shutdownDone.compareAndSet(false, true)) return;
        log.info("Shutting down: flushing hash index and checkpoints");
        try {
            hashIndex.flush(true);
        } catch (RuntimeException e) {
            log.error("Hash index flush failed during shutdown: {}", e.getMessage(), e);
        }
        try {
            checkpointStore.save();
        } catch (RuntimeException e) {
            log.error("Checkpoint save failed during shutdown: {}", e.getMessage(), e);
        }
        lockManager.release();
        removeShutdownHook();
    }

    public boolean isShutdown() {
        return shutdownDone.get();
    }

    private void registerShutdownHook() {
        Thread hook = new Thread(this::shutdown, "generation-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        shutdownHook = hook;
    }

    private void removeShutdownHook() {
        Thread hook = shutdownHook;
        shutdownHook = null;
        if (hook == null || Thread.currentThread() == hook) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; hook stays registered");
        }
    }

    private Set<ContentKind> selectedKinds() {
        List<String> configured = appProperties.getKinds();
        if (configured == null || configured.isEmpty()) return EnumSet.allOf(ContentKind.class);
        Set<ContentKind> out = EnumSet.noneOf(ContentKind.class);
        for (String k : configured) {
            if (k != null && !k.isBlank()) out.add(ContentKind.fromLabel(k));
        }
        return out.isEmpty() ? EnumSet.allOf(ContentKind.class) : out;
    }

    private int targetFor(ContentKind kind) {
        return kind == ContentKind.QUIZZES ? appProperties.getQuizzesTarget() : appProperties.getCuriositiesTarget();
    }

    /**
     * Saves the run report under {@code app.run-history-dir} (default tmp/generation-history) as
     * run_yyyyMMdd_HHmmss.json. Failures are logged and do not fail the run.
     */
    private void persistRunReport(GenerationDtos.RunReport report) {
        log.info("Run finished: {} items generated across {} tasks ({} failed)",
                report.getGenerated_total(), report.getTasks().size(), report.getFailed_tasks());
        report.getTasks().stream()
                .sorted(Comparator.comparing(GenerationDtos.TaskReport::getCategoryId))
                .forEach(t -> log.info("  {}/{} [{}] {} +{} (batches {}, failed {}, invalid {}, dup {})",
                        t.getCategoryId(), t.getKind(), t.getPass(), t.getStatus(), t.getGenerated(),
                        t.getBatchesRequested(), t.getFailedBatches(), t.getRejectedInvalid(),
                        t.getRejectedDuplicate()));
        if (appProperties.isDryRun()) {
            log.info("[dry-run] run report not saved");
            return;
        }
        try {
            String dir = appProperties.getRunHistoryDir();
            if (dir == null || dir.isBlank()) {
                dir = "tmp/generation-history";
            }
            Path historyDir = Paths.get(dir);
            Files.createDirectories(historyDir);
            String ts = ZonedDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmssXXX"));
            Path out = historyDir.resolve("run_" + ts.replace(":", "-") + ".json");
            mapper.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), report);
            log.info("Saved run report to {}", out.toAbsolutePath());
        } catch (Exception e) {
            log.warn("Failed to persist run report: {}", e.toString());
        }
    }
}
