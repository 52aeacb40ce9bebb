package com.ideia.contentgen.service.parsing;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One heuristic in the response repair chain.
 *
 * <p>{@link ResponseParser} runs its strategies in order and keeps the first non-null result, so a
 * strategy only has to answer "can I turn this text into JSON?". Strategies must be side-effect
 * free and must not throw on malformed input.
 *
 * @see ResponseParser
 */
public interface RepairStrategy {
    /**
     * @param text model output with code fences already removed
     * @return the parsed tree, or null when this strategy cannot make sense of the text
     */
    JsonNode attempt(String text);

    default String getName() {
        return this.getClass().getSimpleName();
    }
}
