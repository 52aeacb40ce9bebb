package com.ideia.contentgen.dto;

import java.util.List;
import java.util.Map;

public class GenerationDtos {

    public enum TaskStatus {
        COMPLETED, // reached the requested count
        SKIPPED, // nothing to generate
        STALLED, // gave up after too many empty batches in a row
        INTERRUPTED,
        FAILED // persistence error, task aborted
    }

    /** Outcome of one (category, kind) task. */
    public static class TaskReport {
        private String categoryId;
        private String kind; // curiosities | quizzes
        private String pass; // main | equalize
        private int target;
        private int existingBefore;
        private int itemsToGenerate;
        private int generated;
        private int batchesRequested;
        private int failedBatches; // no usable response or zero accepted items
        private int rejectedInvalid;
        private int rejectedDuplicate;
        private int finalBatchSize;
        private TaskStatus status;
        private String message;
        private long durationMs;

        public String getCategoryId() { return categoryId; }
        public void setCategoryId(String categoryId) { this.categoryId = categoryId; }
        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }
        public String getPass() { return pass; }
        public void setPass(String pass) { this.pass = pass; }
        public int getTarget() { return target; }
        public void setTarget(int target) { this.target = target; }
        public int getExistingBefore() { return existingBefore; }
        public void setExistingBefore(int existingBefore) { this.existingBefore = existingBefore; }
        public int getItemsToGenerate() { return itemsToGenerate; }
        public void setItemsToGenerate(int itemsToGenerate) { this.itemsToGenerate = itemsToGenerate; }
        public int getGenerated() { return generated; }
        public void setGenerated(int generated) { this.generated = generated; }
        public int getBatchesRequested() { return batchesRequested; }
        public void setBatchesRequested(int batchesRequested) { this.batchesRequested = batchesRequested; }
        public int getFailedBatches() { return failedBatches; }
        public void setFailedBatches(int failedBatches) { this.failedBatches = failedBatches; }
        public int getRejectedInvalid() { return rejectedInvalid; }
        public void setRejectedInvalid(int rejectedInvalid) { this.rejectedInvalid = rejectedInvalid; }
        public int getRejectedDuplicate() { return rejectedDuplicate; }
        public void setRejectedDuplicate(int rejectedDuplicate) { this.rejectedDuplicate = rejectedDuplicate; }
        public int getFinalBatchSize() { return finalBatchSize; }
        public void setFinalBatchSize(int finalBatchSize) { this.finalBatchSize = finalBatchSize; }
        public TaskStatus getStatus() { return status; }
        public void setStatus(TaskStatus status) { this.status = status; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
        public long getDurationMs() { return durationMs; }
        public void setDurationMs(long durationMs) { this.durationMs = durationMs; }
    }

    /** Whole-run report, saved to the run history directory. */
    public static class RunReport {
        private String startedAt;
        private String finishedAt;
        private boolean dryRun;
        private String model;
        private int categories;
        private int generated_total;
        private int failed_tasks;
        private List<TaskReport> tasks;
        /** model -> { requests, prompt_tokens, candidate_tokens, total_tokens } */
        private Map<String, Map<String, Object>> ai_usage_per_model;

        public String getStartedAt() { return startedAt; }
        public void setStartedAt(String startedAt) { this.startedAt = startedAt; }
        public String getFinishedAt() { return finishedAt; }
        public void setFinishedAt(String finishedAt) { this.finishedAt = finishedAt; }
        public boolean isDryRun() { return dryRun; }
        public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getCategories() { return categories; }
        public void setCategories(int categories) { this.categories = categories; }
        public int getGenerated_total() { return generated_total; }
        public void setGenerated_total(int generated_total) { this.generated_total = generated_total; }
        public int getFailed_tasks() { return failed_tasks; }
        public void setFailed_tasks(int failed_tasks) { this.failed_tasks = failed_tasks; }
        public List<TaskReport> getTasks() { return tasks; }
        public void setTasks(List<TaskReport> tasks) { this.tasks = tasks; }
        public Map<String, Map<String, Object>> getAi_usage_per_model() { return ai_usage_per_model; }
        public void setAi_usage_per_model(Map<String, Map<String, Object>> ai_usage_per_model) { this.ai_usage_per_model = ai_usage_per_model; }
    }
}
