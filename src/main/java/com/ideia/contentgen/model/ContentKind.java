package com.ideia.contentgen.model;

import java.util.Locale;

/**
 * The two content variants the generator produces. Each kind owns a directory under the data root
 * and an id prefix scheme.
 */
public enum ContentKind {
    CURIOSITIES("curiosities", "curiosities"),
    QUIZZES("quiz-questions", "quizzes");

    private final String directory;
    private final String label;

    ContentKind(String directory, String label) {
        this.directory = directory;
        this.label = label;
    }

    public String getDirectory() {
        return directory;
    }

    public String getLabel() {
        return label;
    }

    /** Prefix of sequential ids: {@code <categoryId>} or {@code quiz-<categoryId>}. */
    public String idPrefix(String categoryId) {
        return this == QUIZZES ? "quiz-" + categoryId : categoryId;
    }

    public Class<? extends ContentItem> itemType() {
        return this == QUIZZES ? QuizQuestion.class : Curiosity.class;
    }

    public static ContentKind fromLabel(String value) {
        if (value == null) throw new IllegalArgumentException("content kind is required");
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ContentKind k : values()) {
            if (k.label.equals(v) || k.directory.equals(v) || k.name().toLowerCase(Locale.ROOT).equals(v)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown content kind: " + value);
    }
}
