package com.ideia.contentgen.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.model.ContentItem;
import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.model.Curiosity;
import com.ideia.contentgen.model.FieldKind;
import com.ideia.contentgen.model.HashIndexSnapshot;
import com.ideia.contentgen.model.QuizQuestion;
import com.ideia.contentgen.util.JsonFiles;
import com.ideia.contentgen.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only fingerprint sets (titles, contents, questions) shared by every worker.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #load(ContentStore, Collection)} re-hashes every persisted item and unions the
 *       snapshot file; the category files are the source of truth, the snapshot only adds to it</li>
 *   <li>{@link #claim(Map)} atomically inserts the fingerprints of an accepted item</li>
 *   <li>{@link #flush(boolean)} persists the sets when forced or after enough insertions</li>
 * </ol>
 *
 * <p>Membership reads are lock free; claims and flushes are serialized on one monitor.
 */
public class HashIndex {
    private static final Logger log = LoggerFactory.getLogger(HashIndex.class);

    private final Path snapshotPath;
    private final ObjectMapper mapper;
    private final int flushThreshold;
    private final boolean readOnly;
    private final Map<FieldKind, Set<String>> sets = new EnumMap<>(FieldKind.class);
    private final Object writeLock = new Object();
    private int dirty = 0;

    /**
     * @param readOnly when true (dry runs) flushes are logged but nothing is written
     */
    public HashIndex(Path snapshotPath, ObjectMapper mapper, int flushThreshold, boolean readOnly) {
        this.snapshotPath = snapshotPath;
        this.mapper = mapper;
        this.flushThreshold = Math.max(1, flushThreshold);
        this.readOnly = readOnly;
        for (FieldKind f : FieldKind.values()) {
            sets.put(f, ConcurrentHashMap.newKeySet());
        }
    }

    public void load(ContentStore store, Collection<String> categoryIds) {
        loadSnapshot();
        int items = 0;
        for (String categoryId : categoryIds) {
            for (ContentKind kind : ContentKind.values()) {
                for (ContentItem item : store.read(kind, categoryId)) {
                    seed(item);
                    items++;
                }
            }
        }
        log.info("Hash index seeded from {} persisted items: {} titles, {} contents, {} questions",
                items, size(FieldKind.TITLE), size(FieldKind.CONTENT), size(FieldKind.QUESTION));
    }

    private void loadSnapshot() {
        if (!Files.exists(snapshotPath)) return;
        try {
            HashIndexSnapshot snap = mapper.readValue(snapshotPath.toFile(), HashIndexSnapshot.class);
            if (snap.getTitles() != null) sets.get(FieldKind.TITLE).addAll(snap.getTitles());
            if (snap.getContents() != null) sets.get(FieldKind.CONTENT).addAll(snap.getContents());
            if (snap.getQuestions() != null) sets.get(FieldKind.QUESTION).addAll(snap.getQuestions());
        } catch (IOException e) {
            // category files are re-hashed anyway
            log.warn("Ignoring unreadable hash index snapshot {}: {}", snapshotPath, e.toString());
        }
    }

    /** Adds the fingerprints of an already persisted item without counting it as dirty. */
    public void seed(ContentItem item) {
        fingerprints(item).forEach((field, fp) -> sets.get(field).add(fp));
    }

    public boolean contains(FieldKind field, String fingerprint) {
        return fingerprint != null && sets.get(field).contains(fingerprint);
    }

    /**
     * Inserts all given fingerprints if none of them is present yet.
     *
     * @return false when any fingerprint was already claimed, in which case nothing is inserted
     */
    public boolean claim(Map<FieldKind, String> fingerprints) {
        synchronized (writeLock) {
            for (Map.Entry<FieldKind, String> e : fingerprints.entrySet()) {
                if (sets.get(e.getKey()).contains(e.getValue())) return false;
            }
            fingerprints.forEach((field, fp) -> sets.get(field).add(fp));
            dirty += fingerprints.size();
            return true;
        }
    }

    /**
     * Writes the snapshot when {@code force} is set or the dirty counter reached the threshold.
     *
     * @return true when a snapshot was written
     */
    public boolean flush(boolean force) {
        synchronized (writeLock) {
            if (!force && dirty < flushThreshold) return false;
            if (dirty == 0 && Files.exists(snapshotPath)) return false;
            if (readOnly) {
                log.info("[dry-run] would flush hash index ({} pending insertions) to {}", dirty, snapshotPath);
                dirty = 0;
                return false;
            }
            HashIndexSnapshot snap = new HashIndexSnapshot();
            snap.setUpdatedAt(Instant.now().toString());
            snap.setTitles(sorted(FieldKind.TITLE));
            snap.setContents(sorted(FieldKind.CONTENT));
            snap.setQuestions(sorted(FieldKind.QUESTION));
            try {
                JsonFiles.writeAtomically(mapper, snapshotPath, snap);
            } catch (IOException e) {
                throw new ContentPersistenceException("Cannot write hash index " + snapshotPath, e);
            }
            log.debug("Hash index flushed ({} insertions since last flush)", dirty);
            dirty = 0;
            return true;
        }
    }

    public int size(FieldKind field) {
        return sets.get(field).size();
    }

    public int pendingInsertions() {
        synchronized (writeLock) {
            return dirty;
        }
    }

    private List<String> sorted(FieldKind field) {
        List<String> out = new ArrayList<>(sets.get(field));
        out.sort(null);
        return out;
    }

    /** Fingerprints an item contributes: title+content for curiosities, question for quizzes. */
    public static Map<FieldKind, String> fingerprints(ContentItem item) {
        Map<FieldKind, String> out = new EnumMap<>(FieldKind.class);
        if (item instanceof Curiosity c) {
            putIfPresent(out, FieldKind.TITLE, c.getTitle());
            putIfPresent(out, FieldKind.CONTENT, c.getContent());
        } else if (item instanceof QuizQuestion q) {
            putIfPresent(out, FieldKind.QUESTION, q.getQuestion());
        }
        return out;
    }

    private static void putIfPresent(Map<FieldKind, String> out, FieldKind field, String text) {
        String fp = TextNormalizer.fingerprintOf(text);
        if (fp != null) out.put(field, fp);
    }
}
