package com.ideia.contentgen.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe process-wide accounting of Gemini token usage during a generation run.
 *
 * <p>Call {@link #reset()} when a run starts, {@link #record(String, long, long, long)} from every
 * successful response, and {@link #snapshot()} when building the run report.
 */
public final class TokenAccounting {
    private TokenAccounting() {}

    public static final class ModelUsage {
        public final AtomicLong requests = new AtomicLong();
        public final AtomicLong promptTokens = new AtomicLong();
        public final AtomicLong candidateTokens = new AtomicLong();
        public final AtomicLong totalTokens = new AtomicLong();
    }

    private static final ConcurrentHashMap<String, ModelUsage> USAGE = new ConcurrentHashMap<>();

    public static void reset() {
        USAGE.clear();
    }

    public static void record(String model, long prompt, long candidates, long total) {
        if (model == null || model.isBlank()) model = "unknown";
        ModelUsage mu = USAGE.computeIfAbsent(model, m -> new ModelUsage());
        mu.requests.incrementAndGet();
        if (prompt > 0) mu.promptTokens.addAndGet(prompt);
        if (candidates > 0) mu.candidateTokens.addAndGet(candidates);
        if (total > 0) mu.totalTokens.addAndGet(total);
    }

    /** model -> { requests, prompt_tokens, candidate_tokens, total_tokens } */
    public static Map<String, Map<String, Object>> snapshot() {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        for (Map.Entry<String, ModelUsage> e : USAGE.entrySet()) {
            ModelUsage mu = e.getValue();
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("requests", mu.requests.get());
            m.put("prompt_tokens", mu.promptTokens.get());
            m.put("candidate_tokens", mu.candidateTokens.get());
            m.put("total_tokens", mu.totalTokens.get());
            out.put(e.getKey(), m);
        }
        return out;
    }
}
