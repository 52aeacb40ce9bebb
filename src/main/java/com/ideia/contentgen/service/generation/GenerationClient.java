package com.ideia.contentgen.service.generation;

import com.ideia.contentgen.model.ContentKind;

/**
 * Boundary to the generative service.
 */
public interface GenerationClient {
    /**
     * Requests {@code count} items of the given kind.
     *
     * @return the raw model text, or null when the call failed for good (non-retriable error,
     *         attempts exhausted, or an empty answer). Callers treat null as "nothing this round".
     */
    String generate(ContentKind kind, String prompt, int count);

    /** Model name used for the first attempt of every call. */
    String primaryModel();
}
