package com.ideia.contentgen.service.parsing;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recovers a JSON array or object wrapped in prose ("Here are your items: [...] Enjoy!").
 *
 * <p>Candidate substrings, tried in order with each delegate strategy:
 * <ol>
 *   <li>top-level bracket-balanced spans, last one first</li>
 *   <li>the widest span from the first {@code [} to the last {@code ]}</li>
 *   <li>the widest span from the first <code>{</code> to the last <code>}</code></li>
 * </ol>
 */
public class BracketExtractionStrategy implements RepairStrategy {
    private static final int MAX_CANDIDATES = 6;

    private final List<RepairStrategy> delegates;

    public BracketExtractionStrategy(List<RepairStrategy> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public JsonNode attempt(String text) {
        if (text == null || text.isBlank()) return null;
        for (String candidate : candidates(text)) {
            for (RepairStrategy s : delegates) {
                JsonNode node = s.attempt(candidate);
                if (node != null && node.isContainerNode()) return node;
            }
        }
        return null;
    }

    static List<String> candidates(String text) {
        Set<String> out = new LinkedHashSet<>();
        List<int[]> spans = balancedSpans(text);
        for (int i = spans.size() - 1; i >= 0 && out.size() < MAX_CANDIDATES; i--) {
            int[] span = spans.get(i);
            out.add(text.substring(span[0], span[1] + 1));
        }
        addWidest(out, text, '[', ']');
        addWidest(out, text, '{', '}');
        return new ArrayList<>(out);
    }

    private static void addWidest(Set<String> out, String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        if (start >= 0 && end > start) out.add(text.substring(start, end + 1));
    }

    /** Top-level spans whose brackets balance, skipping brackets inside double-quoted strings. */
    private static List<int[]> balancedSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') {
                inString = !stack.isEmpty();
            } else if (c == '[' || c == '{') {
                stack.push(i);
            } else if (c == ']' || c == '}') {
                if (stack.isEmpty()) continue;
                char opener = text.charAt(stack.peek());
                if ((c == ']' && opener == '[') || (c == '}' && opener == '{')) {
                    int start = stack.pop();
                    if (stack.isEmpty()) spans.add(new int[]{start, i});
                } else {
                    stack.clear();
                }
            }
        }
        return spans;
    }
}
