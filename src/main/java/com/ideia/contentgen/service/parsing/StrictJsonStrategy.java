package com.ideia.contentgen.service.parsing;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;

/** Plain RFC 8259 parse of the whole text. */
public class StrictJsonStrategy implements RepairStrategy {
    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    @Override
    public JsonNode attempt(String text) {
        return readOrNull(mapper, text);
    }

    static JsonNode readOrNull(ObjectMapper mapper, String text) {
        if (text == null || text.isBlank()) return null;
        try {
            JsonNode node = mapper.readTree(text.trim());
            return node == null || node.isMissingNode() ? null : node;
        } catch (IOException e) {
            return null;
        }
    }
}
