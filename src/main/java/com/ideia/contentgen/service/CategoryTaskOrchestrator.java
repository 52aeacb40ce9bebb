package com.ideia.contentgen.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ideia.contentgen.config.AppProperties;
import com.ideia.contentgen.dto.GenerationDtos;
import com.ideia.contentgen.dto.GenerationDtos.TaskStatus;
import com.ideia.contentgen.model.Category;
import com.ideia.contentgen.model.ContentItem;
import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.model.Curiosity;
import com.ideia.contentgen.model.QuizQuestion;
import com.ideia.contentgen.service.batch.AdaptiveBatchController;
import com.ideia.contentgen.service.dedup.Deduplicator;
import com.ideia.contentgen.service.generation.GenerationClient;
import com.ideia.contentgen.service.generation.PromptBuilder;
import com.ideia.contentgen.service.parsing.ResponseParser;
import com.ideia.contentgen.service.store.CheckpointStore;
import com.ideia.contentgen.service.store.ContentStore;
import com.ideia.contentgen.service.store.HashIndex;
import com.ideia.contentgen.service.validation.ContentValidator;
import com.ideia.contentgen.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Runs one (category, kind) task to completion.
 *
 * <p>Each iteration requests a batch, parses, validates and deduplicates it, and commits the
 * accepted items before the next request is made:
 * <ol>
 *   <li>append to the in-memory list and rewrite the category file atomically</li>
 *   <li>count the batch in the checkpoint</li>
 *   <li>let the hash index flush if enough insertions piled up</li>
 * </ol>
 * Batches that produce nothing feed the {@link AdaptiveBatchController}. Persistence errors are
 * not caught here; they abort the task.
 */
public class CategoryTaskOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CategoryTaskOrchestrator.class);
    static final long MAX_PACING_JITTER_MS = 400L;

    private final ContentStore contentStore;
    private final HashIndex hashIndex;
    private final CheckpointStore checkpointStore;
    private final GenerationClient generationClient;
    private final ResponseParser responseParser;
    private final ContentValidator validator;
    private final Deduplicator deduplicator;
    private final PromptBuilder promptBuilder;
    private final AppProperties appProperties;
    private final Sleeper sleeper;

    public CategoryTaskOrchestrator(ContentStore contentStore, HashIndex hashIndex, CheckpointStore checkpointStore,
                                    GenerationClient generationClient, ResponseParser responseParser,
                                    ContentValidator validator, Deduplicator deduplicator,
                                    PromptBuilder promptBuilder, AppProperties appProperties, Sleeper sleeper) {
        this.contentStore = contentStore;
        this.hashIndex = hashIndex;
        this.checkpointStore = checkpointStore;
        this.generationClient = generationClient;
        this.responseParser = responseParser;
        this.validator = validator;
        this.deduplicator = deduplicator;
        this.promptBuilder = promptBuilder;
        this.appProperties = appProperties;
        this.sleeper = sleeper;
    }

    /** {@code max(0, target - existing)}, or the override when one is given. */
    public static int itemsToGenerate(int target, int existingCount, Integer overrideCount) {
        if (overrideCount != null) return Math.max(0, overrideCount);
        return Math.max(0, target - existingCount);
    }

    public GenerationDtos.TaskReport run(CategoryTask task) {
        long started = System.currentTimeMillis();
        Category category = task.category();
        ContentKind kind = task.kind();
        String name = task.name();

        List<ContentItem> existing = contentStore.read(kind, category.getId());
        List<String> scope = existing.stream()
                .map(ContentItem::dedupKey)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));
        int toGenerate = itemsToGenerate(task.target(), existing.size(), task.overrideCount());

        GenerationDtos.TaskReport report = new GenerationDtos.TaskReport();
        report.setCategoryId(category.getId());
        report.setKind(kind.getLabel());
        report.setPass(task.isEqualization() ? "equalize" : "main");
        report.setTarget(task.target());
        report.setExistingBefore(existing.size());
        report.setItemsToGenerate(toGenerate);

        if (toGenerate == 0) {
            log.info("[{}] {}/{} already at target; nothing to do", name, existing.size(), task.target());
            report.setStatus(TaskStatus.SKIPPED);
            report.setFinalBatchSize(appProperties.getBatchSize());
            report.setDurationMs(System.currentTimeMillis() - started);
            return report;
        }

        int doneBatches = checkpointStore.get(category.getId()).batchesProcessed(kind);
        log.info("=== [{}] {} ({}): {} existing, generating {} (batches committed so far: {}) ===",
                name, category.getName(), report.getPass(), existing.size(), toGenerate, doneBatches);

        AdaptiveBatchController controller = new AdaptiveBatchController(name, appProperties.getBatchSize());
        int generated = 0;
        int failedInRow = 0;
        TaskStatus status = TaskStatus.COMPLETED;

        try {
            while (generated < toGenerate) {
                if (Thread.currentThread().isInterrupted()) {
                    status = TaskStatus.INTERRUPTED;
                    break;
                }
                int remaining = toGenerate - generated;
                int size = controller.requestSize(remaining);
                String prompt = promptBuilder.build(kind, category, size, scope);
                report.setBatchesRequested(report.getBatchesRequested() + 1);

                String raw = generationClient.generate(kind, prompt, size);
                List<JsonNode> candidates = raw == null ? null : responseParser.parse(raw);
                if (candidates == null || candidates.isEmpty()) {
                    controller.onUnusableResponse();
                    report.setFailedBatches(report.getFailedBatches() + 1);
                    if (++failedInRow >= appProperties.getMaxConsecutiveFailedBatches()) {
                        status = TaskStatus.STALLED;
                        break;
                    }
                    pause();
                    continue;
                }

                List<ContentItem> accepted = screen(candidates, task, existing, scope, remaining, report);
                if (accepted.isEmpty()) {
                    log.info("[{}] batch of {} yielded no new items", name, candidates.size());
                    controller.onZeroYield();
                    report.setFailedBatches(report.getFailedBatches() + 1);
                    if (++failedInRow >= appProperties.getMaxConsecutiveFailedBatches()) {
                        status = TaskStatus.STALLED;
                        break;
                    }
                    pause();
                    continue;
                }

                controller.onAccepted();
                failedInRow = 0;
                commit(task, existing, accepted);
                generated += accepted.size();
                log.info("[{}] +{} ({}/{} this run, {} total, batch size {})",
                        name, accepted.size(), generated, toGenerate, existing.size(), controller.getDynamicBatchSize());
                if (generated < toGenerate) pause();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = TaskStatus.INTERRUPTED;
        }

        if (status == TaskStatus.STALLED) {
            log.warn("[{}] giving up after {} batches in a row without new items ({}/{})",
                    name, failedInRow, generated, toGenerate);
            report.setMessage("no accepted items in " + failedInRow + " consecutive batches");
        } else if (status == TaskStatus.INTERRUPTED) {
            log.warn("[{}] interrupted after {}/{} items", name, generated, toGenerate);
        } else {
            log.info("[{}] done: {} items now on disk", name, existing.size());
        }
        report.setGenerated(generated);
        report.setFinalBatchSize(controller.getDynamicBatchSize());
        report.setStatus(status);
        report.setDurationMs(System.currentTimeMillis() - started);
        return report;
    }

    /**
     * Validates and deduplicates candidates, assigning ids to the survivors. Stops once
     * {@code remaining} items are accepted so a task never overshoots its count.
     */
    private List<ContentItem> screen(List<JsonNode> candidates, CategoryTask task, List<ContentItem> existing,
                                     List<String> scope, int remaining, GenerationDtos.TaskReport report) {
        String categoryId = task.category().getId();
        String prefix = task.kind().idPrefix(categoryId);
        List<ContentItem> accepted = new ArrayList<>();
        List<ContentItem> idSpace = new ArrayList<>(existing);

        for (JsonNode node : candidates) {
            if (accepted.size() >= remaining) break;
            if (!validator.validate(node, task.kind())) {
                report.setRejectedInvalid(report.getRejectedInvalid() + 1);
                continue;
            }
            ContentItem item = toItem(node, task.kind(), categoryId, ContentStore.nextSequentialId(idSpace, prefix));
            if (!deduplicator.accept(item, scope)) {
                report.setRejectedDuplicate(report.getRejectedDuplicate() + 1);
                continue;
            }
            accepted.add(item);
            idSpace.add(item);
            scope.add(item.dedupKey());
        }
        return accepted;
    }

    private ContentItem toItem(JsonNode node, ContentKind kind, String categoryId, String id) {
        if (kind == ContentKind.QUIZZES) {
            QuizQuestion q = validator.toQuizQuestion(node);
            q.setId(id);
            q.setCategoryId(categoryId);
            return q;
        }
        Curiosity c = validator.toCuriosity(node);
        c.setId(id);
        c.setCategoryId(categoryId);
        return c;
    }

    private void commit(CategoryTask task, List<ContentItem> existing, List<ContentItem> accepted) {
        existing.addAll(accepted);
        String categoryId = task.category().getId();
        if (appProperties.isDryRun()) {
            log.info("[dry-run] would append {} item(s) to {} ({} total)",
                    accepted.size(), contentStore.fileFor(task.kind(), categoryId), existing.size());
        } else {
            contentStore.write(task.kind(), categoryId, existing);
        }
        checkpointStore.recordBatch(categoryId, task.kind());
        hashIndex.flush(false);
    }

    private void pause() throws InterruptedException {
        long delay = appProperties.getApiCallDelayMs() + ThreadLocalRandom.current().nextLong(MAX_PACING_JITTER_MS);
        sleeper.sleep(delay);
    }
}
