package com.ideia.contentgen.service.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw model output into a list of candidate items, repairing what it can.
 *
 * <p>Markdown code fences are stripped first, then the repair chain runs in order and the first
 * strategy that yields JSON wins:
 * <ol>
 *   <li>{@link StrictJsonStrategy}</li>
 *   <li>{@link LenientJsonStrategy}</li>
 *   <li>{@link BracketExtractionStrategy} over strict, then lenient</li>
 * </ol>
 * An object result is unwrapped to its first array-valued field when it has one
 * ({@code {"items": [...]}}), otherwise it becomes a single-element list.
 */
public class ResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON|json5)?");

    private final List<RepairStrategy> chain;

    public ResponseParser() {
        this(defaultChain());
    }

    public ResponseParser(List<RepairStrategy> chain) {
        this.chain = List.copyOf(chain);
    }

    public static List<RepairStrategy> defaultChain() {
        RepairStrategy strict = new StrictJsonStrategy();
        RepairStrategy lenient = new LenientJsonStrategy();
        return List.of(strict, lenient, new BracketExtractionStrategy(List.of(strict, lenient)));
    }

    /**
     * @return candidate items (possibly empty), or null when no strategy could parse the text
     */
    public List<JsonNode> parse(String rawText) {
        if (rawText == null || rawText.isBlank()) return null;
        String cleaned = CODE_FENCE.matcher(rawText).replaceAll("").trim();
        for (RepairStrategy strategy : chain) {
            JsonNode node = strategy.attempt(cleaned);
            if (node == null) continue;
            List<JsonNode> items = toItems(node);
            if (items != null) {
                log.debug("Parsed {} candidate(s) via {}", items.size(), strategy.getName());
                return items;
            }
        }
        log.warn("Unparsable model output ({} chars): {}", rawText.length(), truncateForLog(rawText));
        return null;
    }

    static List<JsonNode> toItems(JsonNode node) {
        if (node.isArray()) {
            List<JsonNode> out = new ArrayList<>(node.size());
            node.forEach(out::add);
            return out;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (value.isArray()) return toItems(value);
            }
            return new ArrayList<>(List.of(node));
        }
        return null;
    }

    private static String truncateForLog(String s) {
        String oneLine = s.replaceAll("\\s+", " ");
        return oneLine.length() <= 200 ? oneLine : oneLine.substring(0, 200) + "…";
    }
}
