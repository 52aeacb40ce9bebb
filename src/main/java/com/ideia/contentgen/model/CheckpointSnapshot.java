package com.ideia.contentgen.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** On-disk shape of the checkpoint file. */
public class CheckpointSnapshot {
    private String updatedAt;
    private Map<String, CategoryCheckpoint> categories = new LinkedHashMap<>();

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Map<String, CategoryCheckpoint> getCategories() {
        return categories;
    }

    public void setCategories(Map<String, CategoryCheckpoint> categories) {
        this.categories = categories;
    }
}
