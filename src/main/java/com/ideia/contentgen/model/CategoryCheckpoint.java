package com.ideia.contentgen.model;

/** Per-category progress counters. Counters only ever grow. */
public class CategoryCheckpoint {
    private int curiositiesBatchesProcessed;
    private int quizzesBatchesProcessed;
    private String lastRunAt; // ISO-8601 instant

    public int getCuriositiesBatchesProcessed() {
        return curiositiesBatchesProcessed;
    }

    public void setCuriositiesBatchesProcessed(int curiositiesBatchesProcessed) {
        this.curiositiesBatchesProcessed = curiositiesBatchesProcessed;
    }

    public int getQuizzesBatchesProcessed() {
        return quizzesBatchesProcessed;
    }

    public void setQuizzesBatchesProcessed(int quizzesBatchesProcessed) {
        this.quizzesBatchesProcessed = quizzesBatchesProcessed;
    }

    public String getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(String lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public int batchesProcessed(ContentKind kind) {
        return kind == ContentKind.QUIZZES ? quizzesBatchesProcessed : curiositiesBatchesProcessed;
    }

    public CategoryCheckpoint copy() {
        CategoryCheckpoint c = new CategoryCheckpoint();
        c.curiositiesBatchesProcessed = curiositiesBatchesProcessed;
        c.quizzesBatchesProcessed = quizzesBatchesProcessed;
        c.lastRunAt = lastRunAt;
        return c;
    }
}
