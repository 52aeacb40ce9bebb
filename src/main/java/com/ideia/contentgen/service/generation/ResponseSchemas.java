package com.ideia.contentgen.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ideia.contentgen.model.ContentKind;

/**
 * Structured-output schemas sent with every request (Gemini OpenAPI subset: upper-case types).
 * Both are arrays of objects.
 */
public final class ResponseSchemas {
    private ResponseSchemas() {}

    private static final JsonNodeFactory F = JsonNodeFactory.instance;
    private static final JsonNode CURIOSITIES = buildCuriosities();
    private static final JsonNode QUIZZES = buildQuizzes();

    public static JsonNode forKind(ContentKind kind) {
        return kind == ContentKind.QUIZZES ? QUIZZES : CURIOSITIES;
    }

    private static JsonNode buildCuriosities() {
        ObjectNode props = F.objectNode();
        props.set("title", string("Título curto e intrigante"));
        props.set("hook", string("Frase curta que prende a atenção"));
        props.set("content", string("Parágrafo de 40 a 90 palavras"));
        props.set("funFact", string("Fato extra surpreendente"));
        ObjectNode level = F.objectNode();
        level.put("type", "INTEGER");
        level.put("description", "1 = comum, 5 = ultra-raro");
        props.set("curiosityLevel", level);
        return arrayOf(props, "title", "content", "funFact");
    }

    private static JsonNode buildQuizzes() {
        ObjectNode props = F.objectNode();
        ObjectNode difficulty = string("Dificuldade");
        ArrayNode levels = difficulty.putArray("enum");
        levels.add("easy").add("medium").add("hard");
        props.set("difficulty", difficulty);
        props.set("question", string("Pergunta curta e clara"));
        ObjectNode options = F.objectNode();
        options.put("type", "ARRAY");
        options.set("items", string("Alternativa"));
        options.put("minItems", 4);
        options.put("maxItems", 4);
        props.set("options", options);
        props.set("correctAnswer", string("Texto idêntico a uma das alternativas"));
        props.set("explanation", string("Por que a resposta certa está certa"));
        return arrayOf(props, "difficulty", "question", "options", "correctAnswer", "explanation");
    }

    private static ObjectNode string(String description) {
        ObjectNode n = F.objectNode();
        n.put("type", "STRING");
        n.put("description", description);
        return n;
    }

    private static JsonNode arrayOf(ObjectNode properties, String... required) {
        ObjectNode item = F.objectNode();
        item.put("type", "OBJECT");
        item.set("properties", properties);
        ArrayNode req = item.putArray("required");
        for (String r : required) req.add(r);
        ObjectNode root = F.objectNode();
        root.put("type", "ARRAY");
        root.set("items", item);
        return root;
    }
}
