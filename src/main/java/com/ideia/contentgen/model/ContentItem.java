package com.ideia.contentgen.model;

/**
 * A persisted unit of content. Items are immutable once written to a category file; new items are
 * only ever appended.
 */
public interface ContentItem {
    String getId();

    String getCategoryId();

    /** Text the fuzzy duplicate check compares against: the title or the question. */
    String dedupKey();
}
