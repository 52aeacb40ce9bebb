package com.ideia.contentgen.service.generation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One request to one model, no retries.
 */
@FunctionalInterface
public interface ModelInvoker {
    /**
     * @param responseSchema structured-output schema the model must follow
     * @return the model's text (may be blank)
     */
    String invoke(String model, String prompt, JsonNode responseSchema) throws GenerationServiceException;
}
