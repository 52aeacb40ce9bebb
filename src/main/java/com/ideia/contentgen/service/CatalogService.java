package com.ideia.contentgen.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.config.AppProperties;
import com.ideia.contentgen.model.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the category catalog and applies the include/exclude selectors.
 */
@Service
public class CatalogService {
    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final AppProperties appProperties;
    private final ObjectMapper mapper;

    public CatalogService(AppProperties appProperties, ObjectMapper mapper) {
        this.appProperties = appProperties;
        this.mapper = mapper;
    }

    /** Every category of the catalog file in file order. */
    public List<Category> loadAll() {
        Path path = Paths.get(appProperties.getCatalogPath());
        if (!Files.exists(path)) {
            throw new IllegalStateException("Category catalog not found: " + path.toAbsolutePath());
        }
        List<Category> categories;
        try {
            categories = mapper.readValue(path.toFile(), new TypeReference<List<Category>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read category catalog " + path + ": " + e.getMessage(), e);
        }
        if (categories == null) return List.of();

        Set<String> seen = new HashSet<>();
        List<Category> out = new ArrayList<>();
        for (Category c : categories) {
            if (c == null || c.getId() == null || c.getId().isBlank()) {
                log.warn("Skipping catalog entry without id");
                continue;
            }
            if (!seen.add(c.getId())) {
                log.warn("Duplicate category id '{}' in catalog; keeping the first entry", c.getId());
                continue;
            }
            if (c.getName() == null || c.getName().isBlank()) c.setName(c.getId());
            out.add(c);
        }
        return out;
    }

    /**
     * Categories selected for this run: all of them, narrowed to {@code app.categories} when set,
     * minus {@code app.exclude-categories}. Unknown ids in the include list are reported.
     */
    public List<Category> selected(List<Category> all) {
        Set<String> include = new LinkedHashSet<>(trimmed(appProperties.getCategories()));
        Set<String> exclude = new HashSet<>(trimmed(appProperties.getExcludeCategories()));

        List<Category> out = new ArrayList<>();
        for (Category c : all) {
            if (!include.isEmpty() && !include.contains(c.getId())) continue;
            if (exclude.contains(c.getId())) continue;
            out.add(c);
        }
        for (String id : include) {
            if (all.stream().noneMatch(c -> c.getId().equals(id))) {
                log.warn("Requested category '{}' is not in the catalog", id);
            }
        }
        return out;
    }

    private static List<String> trimmed(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return out;
    }
}
