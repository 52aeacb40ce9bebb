package com.ideia.contentgen.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.ideia.contentgen.model.ContentKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RetryingGenerationClientTest {

    private static final String PRIMARY = "gemini-1.5-flash";
    private static final String FALLBACK = "gemini-1.5-pro";

    /** Replays scripted outcomes: a String is returned, a GenerationServiceException is thrown. */
    static class ScriptedInvoker implements ModelInvoker {
        final Deque<Object> outcomes = new ArrayDeque<>();
        final List<String> models = new ArrayList<>();
        final List<JsonNode> schemas = new ArrayList<>();

        ScriptedInvoker then(Object outcome) {
            outcomes.add(outcome);
            return this;
        }

        ScriptedInvoker failWith(Integer status, int times) {
            for (int i = 0; i < times; i++) outcomes.add(new GenerationServiceException(status, "HTTP " + status));
            return this;
        }

        @Override
        public String invoke(String model, String prompt, JsonNode responseSchema) throws GenerationServiceException {
            models.add(model);
            schemas.add(responseSchema);
            Object next = outcomes.poll();
            if (next instanceof GenerationServiceException e) throw e;
            return (String) next;
        }
    }

    private final List<Long> sleeps = new ArrayList<>();

    private RetryingGenerationClient client(ScriptedInvoker invoker, String fallback) {
        return new RetryingGenerationClient(invoker, new RetryPolicy(5, 100, () -> 0L), PRIMARY, fallback, sleeps::add);
    }

    @Test
    public void succeedsFirstTimeWithoutSleeping() {
        ScriptedInvoker invoker = new ScriptedInvoker().then("[{}]");
        assertEquals("[{}]", client(invoker, FALLBACK).generate(ContentKind.QUIZZES, "p", 5));
        assertEquals(List.of(PRIMARY), invoker.models);
        assertEquals(ResponseSchemas.forKind(ContentKind.QUIZZES), invoker.schemas.get(0));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void switchesToFallbackAtTheMidpointAttempt() {
        ScriptedInvoker invoker = new ScriptedInvoker().failWith(503, 2).then("[]");
        assertEquals("[]", client(invoker, FALLBACK).generate(ContentKind.CURIOSITIES, "p", 5));
        assertEquals(List.of(PRIMARY, PRIMARY, FALLBACK), invoker.models);
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    public void exhaustedAttemptsReturnNullAndUseFallbackOnlyOnce() {
        ScriptedInvoker invoker = new ScriptedInvoker().failWith(429, 10);
        assertNull(client(invoker, FALLBACK).generate(ContentKind.CURIOSITIES, "p", 5));
        assertEquals(List.of(PRIMARY, PRIMARY, FALLBACK, FALLBACK, FALLBACK), invoker.models);
        assertEquals(List.of(100L, 200L, 400L, 800L), sleeps);
    }

    @Test
    public void nonRetriableStatusStopsImmediately() {
        ScriptedInvoker invoker = new ScriptedInvoker().failWith(400, 1).then("never");
        assertNull(client(invoker, FALLBACK).generate(ContentKind.CURIOSITIES, "p", 5));
        assertEquals(1, invoker.models.size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void statuslessFailuresAreRetriedOnlyWhileInTheFirstHalf() {
        ScriptedInvoker invoker = new ScriptedInvoker().failWith(null, 5);
        assertNull(client(invoker, FALLBACK).generate(ContentKind.CURIOSITIES, "p", 5));
        assertEquals(List.of(PRIMARY, PRIMARY, FALLBACK), invoker.models);
    }

    @Test
    public void blankTextIsNullWithoutRetry() {
        ScriptedInvoker invoker = new ScriptedInvoker().then("   ").then("[]");
        assertNull(client(invoker, FALLBACK).generate(ContentKind.CURIOSITIES, "p", 5));
        assertEquals(1, invoker.models.size());
    }

    @Test
    public void withoutFallbackEveryAttemptUsesThePrimaryModel() {
        ScriptedInvoker invoker = new ScriptedInvoker().failWith(500, 5);
        assertNull(client(invoker, "").generate(ContentKind.CURIOSITIES, "p", 5));
        assertEquals(5, invoker.models.size());
        assertTrue(invoker.models.stream().allMatch(PRIMARY::equals));
    }

    @Test
    public void interruptedBackoffGivesUp() {
        ScriptedInvoker invoker = new ScriptedInvoker().failWith(503, 5);
        RetryingGenerationClient c = new RetryingGenerationClient(invoker, new RetryPolicy(5, 100, () -> 0L),
                PRIMARY, FALLBACK, ms -> {
                    throw new InterruptedException("stop");
                });
        try {
            assertNull(c.generate(ContentKind.CURIOSITIES, "p", 5));
            assertEquals(1, invoker.models.size());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
