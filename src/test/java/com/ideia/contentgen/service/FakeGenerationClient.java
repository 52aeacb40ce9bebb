package com.ideia.contentgen.service;

import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.service.generation.GenerationClient;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Generation client double. Scripted responses (null allowed) are returned first, then the
 * optional generator is consulted; with neither, every call returns null.
 */
class FakeGenerationClient implements GenerationClient {
    private final Deque<String> scripted = new LinkedList<>();
    private final List<Integer> requestedCounts = new ArrayList<>();
    private final List<String> prompts = new ArrayList<>();
    private BiFunction<ContentKind, Integer, String> generator;

    FakeGenerationClient respond(String... responses) {
        for (String r : responses) scripted.add(r);
        return this;
    }

    FakeGenerationClient generator(BiFunction<ContentKind, Integer, String> generator) {
        this.generator = generator;
        return this;
    }

    @Override
    public synchronized String generate(ContentKind kind, String prompt, int count) {
        requestedCounts.add(count);
        prompts.add(prompt);
        if (!scripted.isEmpty()) return scripted.poll();
        return generator == null ? null : generator.apply(kind, count);
    }

    @Override
    public String primaryModel() {
        return "fake-model";
    }

    synchronized int calls() {
        return requestedCounts.size();
    }

    synchronized List<Integer> requestedCounts() {
        return new ArrayList<>(requestedCounts);
    }

    synchronized List<String> prompts() {
        return new ArrayList<>(prompts);
    }
}
