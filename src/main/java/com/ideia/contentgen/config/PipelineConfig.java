package com.ideia.contentgen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideia.contentgen.service.CategoryTaskOrchestrator;
import com.ideia.contentgen.service.dedup.Deduplicator;
import com.ideia.contentgen.service.generation.GeminiModelInvoker;
import com.ideia.contentgen.service.generation.GenerationClient;
import com.ideia.contentgen.service.generation.ModelInvoker;
import com.ideia.contentgen.service.generation.PromptBuilder;
import com.ideia.contentgen.service.generation.RetryPolicy;
import com.ideia.contentgen.service.generation.RetryingGenerationClient;
import com.ideia.contentgen.service.parsing.ResponseParser;
import com.ideia.contentgen.service.store.CheckpointStore;
import com.ideia.contentgen.service.store.ContentStore;
import com.ideia.contentgen.service.store.HashIndex;
import com.ideia.contentgen.service.store.LockManager;
import com.ideia.contentgen.service.validation.ContentValidator;
import com.ideia.contentgen.util.GeminiRateLimiter;
import com.ideia.contentgen.util.Sleeper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Wires the pipeline components. Everything below the run service is a plain class so tests can
 * assemble it without a Spring context.
 */
@Configuration
public class PipelineConfig {
    static final String HASH_INDEX_FILE = ".hash-index.json";
    static final String CHECKPOINT_FILE = ".checkpoints.json";
    static final String LOCK_FILE = ".generator.lock";

    private Path dataDir(AppProperties appProperties) {
        return Paths.get(appProperties.getDataDir());
    }

    @Bean
    public ContentStore contentStore(AppProperties appProperties, ObjectMapper objectMapper) {
        return new ContentStore(dataDir(appProperties), objectMapper);
    }

    @Bean
    public HashIndex hashIndex(AppProperties appProperties, ObjectMapper objectMapper) {
        return new HashIndex(dataDir(appProperties).resolve(HASH_INDEX_FILE), objectMapper,
                appProperties.getHashFlushThreshold(), appProperties.isDryRun());
    }

    @Bean
    public CheckpointStore checkpointStore(AppProperties appProperties, ObjectMapper objectMapper) {
        return new CheckpointStore(dataDir(appProperties).resolve(CHECKPOINT_FILE), objectMapper,
                appProperties.isDryRun());
    }

    @Bean
    public LockManager lockManager(AppProperties appProperties, ObjectMapper objectMapper) {
        return new LockManager(dataDir(appProperties).resolve(LOCK_FILE), objectMapper);
    }

    @Bean
    public ResponseParser responseParser() {
        return new ResponseParser();
    }

    @Bean
    public ContentValidator contentValidator() {
        return new ContentValidator();
    }

    @Bean
    public Deduplicator deduplicator(HashIndex hashIndex, AppProperties appProperties) {
        return new Deduplicator(hashIndex, appProperties.getSimilarityThreshold());
    }

    @Bean
    public PromptBuilder promptBuilder() {
        return new PromptBuilder();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public GeminiRateLimiter geminiRateLimiter(GeminiProperties geminiProperties) {
        return new GeminiRateLimiter(geminiProperties.getRpm());
    }

    @Bean
    public ModelInvoker modelInvoker(@Qualifier("geminiClient") WebClient geminiClient,
                                     ObjectMapper objectMapper,
                                     GeminiProperties geminiProperties,
                                     GeminiRateLimiter rateLimiter) {
        String apiKey = geminiProperties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("gemini.api-key is not set (export GEMINI_API_KEY)");
        }
        return new GeminiModelInvoker(geminiClient, objectMapper, apiKey, geminiProperties.getTemperature(),
                Duration.ofSeconds(geminiProperties.getRequestTimeoutSec()), rateLimiter);
    }

    @Bean
    public GenerationClient generationClient(ModelInvoker modelInvoker, GeminiProperties geminiProperties,
                                             Sleeper sleeper) {
        RetryPolicy policy = new RetryPolicy(geminiProperties.getMaxAttempts(), geminiProperties.getBaseRetryDelayMs());
        return new RetryingGenerationClient(modelInvoker, policy, geminiProperties.getModel(),
                geminiProperties.getFallbackModel(), sleeper);
    }

    @Bean
    public CategoryTaskOrchestrator categoryTaskOrchestrator(ContentStore contentStore,
                                                             HashIndex hashIndex,
                                                             CheckpointStore checkpointStore,
                                                             GenerationClient generationClient,
                                                             ResponseParser responseParser,
                                                             ContentValidator contentValidator,
                                                             Deduplicator deduplicator,
                                                             PromptBuilder promptBuilder,
                                                             AppProperties appProperties,
                                                             Sleeper sleeper) {
        return new CategoryTaskOrchestrator(contentStore, hashIndex, checkpointStore, generationClient,
                responseParser, contentValidator, deduplicator, promptBuilder, appProperties, sleeper);
    }
}
