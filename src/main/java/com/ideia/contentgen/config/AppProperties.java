package com.ideia.contentgen.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Root of the content store. Holds curiosities/, quiz-questions/, the checkpoint file,
     * the hash index snapshot and the lock file.
     */
    @NotBlank
    private String dataDir = "data";
    /**
     * JSON array of categories ({id, name, ...}) the run iterates over.
     */
    @NotBlank
    private String catalogPath = "data/categories.json";
    /** Only these category ids are processed when non-empty. */
    private List<String> categories = new ArrayList<>();
    /** Category ids skipped even when matched by {@link #categories}. */
    private List<String> excludeCategories = new ArrayList<>();
    /** Content kinds to generate: curiosities, quizzes. Empty means both. */
    private List<String> kinds = new ArrayList<>();

    @Min(0)
    private int curiositiesTarget = 1000;
    @Min(0)
    private int quizzesTarget = 500;
    @Min(2)
    private int batchSize = 50;
    @Min(1)
    private int concurrency = 4;
    @Min(0)
    private long apiCallDelayMs = 1200;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.82;
    @Min(1)
    private int hashFlushThreshold = 200;
    /**
     * Batches in a row without a single accepted item before a task gives up.
     */
    @Min(1)
    private int maxConsecutiveFailedBatches = 25;

    // Run modes
    private boolean forceLock;
    private boolean dryRun;
    private boolean equalize = true;
    private boolean equalizeOnly;
    private boolean cleanupOrphans = true;

    /**
     * Directory where run reports are saved as timestamped JSON files.
     * Defaults to "tmp/generation-history" when not set.
     */
    private String runHistoryDir;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getCatalogPath() {
        return catalogPath;
    }

    public void setCatalogPath(String catalogPath) {
        this.catalogPath = catalogPath;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public List<String> getExcludeCategories() {
        return excludeCategories;
    }

    public void setExcludeCategories(List<String> excludeCategories) {
        this.excludeCategories = excludeCategories;
    }

    public List<String> getKinds() {
        return kinds;
    }

    public void setKinds(List<String> kinds) {
        this.kinds = kinds;
    }

    public int getCuriositiesTarget() {
        return curiositiesTarget;
    }

    public void setCuriositiesTarget(int curiositiesTarget) {
        this.curiositiesTarget = curiositiesTarget;
    }

    public int getQuizzesTarget() {
        return quizzesTarget;
    }

    public void setQuizzesTarget(int quizzesTarget) {
        this.quizzesTarget = quizzesTarget;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public long getApiCallDelayMs() {
        return apiCallDelayMs;
    }

    public void setApiCallDelayMs(long apiCallDelayMs) {
        this.apiCallDelayMs = apiCallDelayMs;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public int getHashFlushThreshold() {
        return hashFlushThreshold;
    }

    public void setHashFlushThreshold(int hashFlushThreshold) {
        this.hashFlushThreshold = hashFlushThreshold;
    }

    public int getMaxConsecutiveFailedBatches() {
        return maxConsecutiveFailedBatches;
    }

    public void setMaxConsecutiveFailedBatches(int maxConsecutiveFailedBatches) {
        this.maxConsecutiveFailedBatches = maxConsecutiveFailedBatches;
    }

    public boolean isForceLock() {
        return forceLock;
    }

    public void setForceLock(boolean forceLock) {
        this.forceLock = forceLock;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isEqualize() {
        return equalize;
    }

    public void setEqualize(boolean equalize) {
        this.equalize = equalize;
    }

    public boolean isEqualizeOnly() {
        return equalizeOnly;
    }

    public void setEqualizeOnly(boolean equalizeOnly) {
        this.equalizeOnly = equalizeOnly;
    }

    public boolean isCleanupOrphans() {
        return cleanupOrphans;
    }

    public void setCleanupOrphans(boolean cleanupOrphans) {
        this.cleanupOrphans = cleanupOrphans;
    }

    public String getRunHistoryDir() {
        return runHistoryDir;
    }

    public void setRunHistoryDir(String runHistoryDir) {
        this.runHistoryDir = runHistoryDir;
    }
}
