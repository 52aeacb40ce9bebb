package com.ideia.contentgen.service.store;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.model.ContentItem;
import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.util.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One JSON array file per category per kind: {@code <dataDir>/curiosities/<id>.json} and
 * {@code <dataDir>/quiz-questions/<id>.json}. Files are rewritten whole through
 * {@link JsonFiles#writeAtomically}, so a reader never sees a partial array.
 */
public class ContentStore {
    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);
    private static final String EXT = ".json";

    private final Path dataDir;
    private final ObjectMapper mapper;

    public ContentStore(Path dataDir, ObjectMapper mapper) {
        this.dataDir = dataDir;
        this.mapper = mapper;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path directoryFor(ContentKind kind) {
        return dataDir.resolve(kind.getDirectory());
    }

    public Path fileFor(ContentKind kind, String categoryId) {
        return directoryFor(kind).resolve(categoryId + EXT);
    }

    public void ensureDirectories() {
        try {
            for (ContentKind kind : ContentKind.values()) {
                Files.createDirectories(directoryFor(kind));
            }
        } catch (IOException e) {
            throw new ContentPersistenceException("Cannot create content directories under " + dataDir, e);
        }
    }

    /**
     * Reads a category file. A missing or blank file is an empty category; an unreadable one is an
     * error, since rewriting it would drop whatever it held.
     */
    public List<ContentItem> read(ContentKind kind, String categoryId) {
        Path file = fileFor(kind, categoryId);
        if (!Files.exists(file)) return new ArrayList<>();
        try {
            String txt = Files.readString(file);
            if (txt.isBlank()) return new ArrayList<>();
            JavaType type = mapper.getTypeFactory().constructCollectionType(List.class, kind.itemType());
            List<ContentItem> items = mapper.readValue(txt, type);
            return items == null ? new ArrayList<>() : new ArrayList<>(items);
        } catch (IOException e) {
            throw new ContentPersistenceException("Cannot read " + file, e);
        }
    }

    /** Writes the full array, ordered by numeric id suffix. */
    public void write(ContentKind kind, String categoryId, List<? extends ContentItem> items) {
        Path file = fileFor(kind, categoryId);
        List<ContentItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingLong(i -> idSuffix(i.getId())));
        try {
            JsonFiles.writeAtomically(mapper, file, sorted);
        } catch (IOException e) {
            throw new ContentPersistenceException("Cannot write " + file, e);
        }
    }

    /** Category ids that currently have a file for the given kind. */
    public List<String> listCategoryIds(ContentKind kind) {
        Path dir = directoryFor(kind);
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(EXT))
                    .map(n -> n.substring(0, n.length() - EXT.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ContentPersistenceException("Cannot list " + dir, e);
        }
    }

    public void delete(ContentKind kind, String categoryId) {
        Path file = fileFor(kind, categoryId);
        try {
            Files.deleteIfExists(file);
            log.info("Removed orphan {} file {}", kind.getLabel(), file);
        } catch (IOException e) {
            throw new ContentPersistenceException("Cannot delete " + file, e);
        }
    }

    /**
     * Next id for a category: {@code <prefix>-<max numeric suffix + 1>}. Suffixes that are not
     * numbers count as 0.
     */
    public static String nextSequentialId(List<? extends ContentItem> existing, String prefix) {
        long max = 0;
        for (ContentItem it : existing) {
            long n = idSuffix(it.getId());
            if (n > max) max = n;
        }
        return prefix + "-" + (max + 1);
    }

    static long idSuffix(String id) {
        if (id == null) return 0;
        int dash = id.lastIndexOf('-');
        String suffix = dash >= 0 ? id.substring(dash + 1) : id;
        try {
            return Long.parseLong(suffix.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
