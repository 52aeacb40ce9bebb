package com.ideia.contentgen.service.dedup;

import com.ideia.contentgen.model.ContentItem;
import com.ideia.contentgen.model.Curiosity;
import com.ideia.contentgen.model.FieldKind;
import com.ideia.contentgen.model.QuizQuestion;
import com.ideia.contentgen.service.store.HashIndex;
import com.ideia.contentgen.util.StringSimilarity;
import com.ideia.contentgen.util.TextNormalizer;

import java.util.Collection;
import java.util.List;

/**
 * Rejects candidates that repeat existing content.
 *
 * <p>A text is a duplicate when any of these holds:
 * <ul>
 *   <li>nothing is left after normalization</li>
 *   <li>its fingerprint is already in the hash index for the field</li>
 *   <li>it equals a string in the caller's scope verbatim</li>
 *   <li>its best Dice similarity against the scope reaches the threshold</li>
 * </ul>
 * The scope is what the caller has seen for this category: items on disk plus items accepted
 * earlier in the same batch.
 */
public class Deduplicator {
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.82;

    private final HashIndex hashIndex;
    private final double similarityThreshold;

    public Deduplicator(HashIndex hashIndex, double similarityThreshold) {
        this.hashIndex = hashIndex;
        this.similarityThreshold = similarityThreshold;
    }

    public boolean isDuplicate(String candidateText, FieldKind fieldKind, Collection<String> existingTextsInScope) {
        String normalized = TextNormalizer.normalize(candidateText);
        if (normalized.isEmpty()) return true;
        if (hashIndex.contains(fieldKind, TextNormalizer.fingerprint(normalized))) return true;
        if (existingTextsInScope == null || existingTextsInScope.isEmpty()) return false;
        if (existingTextsInScope.contains(candidateText)) return true;
        return StringSimilarity.bestMatch(candidateText, existingTextsInScope) >= similarityThreshold;
    }

    /**
     * Title is checked against the scope; content by fingerprint only.
     */
    public boolean isDuplicateCuriosity(Curiosity c, Collection<String> existingTitles) {
        return isDuplicate(c.getTitle(), FieldKind.TITLE, existingTitles)
                || isDuplicate(c.getContent(), FieldKind.CONTENT, List.of());
    }

    public boolean isDuplicateQuestion(QuizQuestion q, Collection<String> existingQuestions) {
        return isDuplicate(q.getQuestion(), FieldKind.QUESTION, existingQuestions);
    }

    /**
     * Checks an item and, when it is new, records its fingerprints in the hash index. The claim is
     * atomic, so when two workers race on the same text only one of them accepts it.
     *
     * @return true when the item was accepted
     */
    public boolean accept(ContentItem item, Collection<String> scope) {
        boolean duplicate;
        if (item instanceof Curiosity c) {
            duplicate = isDuplicateCuriosity(c, scope);
        } else if (item instanceof QuizQuestion q) {
            duplicate = isDuplicateQuestion(q, scope);
        } else {
            throw new IllegalArgumentException("Unsupported item type " + item.getClass().getName());
        }
        return !duplicate && hashIndex.claim(HashIndex.fingerprints(item));
    }
}
