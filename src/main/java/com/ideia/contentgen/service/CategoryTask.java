package com.ideia.contentgen.service;

import com.ideia.contentgen.model.Category;
import com.ideia.contentgen.model.ContentKind;

/**
 * One unit of work for the worker pool.
 *
 * @param overrideCount exact number of items to add (equalization pass); null means
 *                      {@code target - existing}
 */
public record CategoryTask(Category category, ContentKind kind, int target, Integer overrideCount) {

    public static CategoryTask main(Category category, ContentKind kind, int target) {
        return new CategoryTask(category, kind, target, null);
    }

    public static CategoryTask equalize(Category category, ContentKind kind, int target, int missing) {
        return new CategoryTask(category, kind, target, missing);
    }

    public boolean isEqualization() {
        return overrideCount != null;
    }

    public String name() {
        return category.getId() + "/" + kind.getLabel();
    }
}
