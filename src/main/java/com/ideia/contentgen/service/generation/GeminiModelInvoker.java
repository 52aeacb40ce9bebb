package com.ideia.contentgen.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ideia.contentgen.util.GeminiRateLimiter;
import com.ideia.contentgen.util.TokenAccounting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Single generateContent call against the Gemini REST API.
 *
 * <p>Sends the prompt with {@code responseMimeType=application/json} and the kind's response
 * schema, and returns the concatenated text parts of the first candidate. HTTP errors surface as
 * {@link GenerationServiceException} with the status; timeouts and transport errors carry none.
 */
public class GeminiModelInvoker implements ModelInvoker {
    private static final Logger log = LoggerFactory.getLogger(GeminiModelInvoker.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final double temperature;
    private final Duration timeout;
    private final GeminiRateLimiter rateLimiter;

    public GeminiModelInvoker(WebClient webClient, ObjectMapper objectMapper, String apiKey,
                              double temperature, Duration timeout, GeminiRateLimiter rateLimiter) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.timeout = timeout;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String invoke(String model, String prompt, JsonNode responseSchema) throws GenerationServiceException {
        ObjectNode request = buildRequest(prompt, responseSchema);
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationServiceException(null, "Interrupted while waiting for rate limit", e);
        }

        log.debug("Gemini request → model={} promptChars={}", model, prompt.length());
        JsonNode response;
        try {
            response = webClient.post()
                    .uri("/models/{model}:generateContent", model)
                    .header("x-goog-api-key", apiKey == null ? "" : apiKey)
                    .bodyValue(request.toString())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 429) {
                try {
                    rateLimiter.onRateLimitHit();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
            throw new GenerationServiceException(status,
                    "Gemini HTTP " + status + ": " + truncateForLog(e.getResponseBodyAsString()), e);
        } catch (RuntimeException e) {
            throw new GenerationServiceException(null, "Gemini call failed: " + e, e);
        }

        if (response == null) return null;
        recordUsage(model, response);
        String blockReason = response.path("promptFeedback").path("blockReason").asText("");
        if (!blockReason.isEmpty()) {
            log.warn("Gemini blocked the prompt (model={}, reason={})", model, blockReason);
            return null;
        }
        return extractText(response);
    }

    ObjectNode buildRequest(String prompt, JsonNode responseSchema) {
        ObjectNode request = objectMapper.createObjectNode();
        ArrayNode contents = request.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        user.putArray("parts").addObject().put("text", prompt);

        ObjectNode config = request.putObject("generationConfig");
        config.put("temperature", temperature);
        config.put("responseMimeType", "application/json");
        if (responseSchema != null) config.set("responseSchema", responseSchema);
        return request;
    }

    /** Text parts of the first candidate, concatenated; null when there is none. */
    static String extractText(JsonNode response) {
        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) return null;
        StringBuilder sb = new StringBuilder();
        for (JsonNode p : parts) {
            JsonNode t = p.get("text");
            if (t != null && t.isTextual()) sb.append(t.asText());
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    private static void recordUsage(String model, JsonNode response) {
        JsonNode usage = response.path("usageMetadata");
        if (usage.isMissingNode()) return;
        String usedModel = response.path("modelVersion").asText(model);
        TokenAccounting.record(usedModel,
                usage.path("promptTokenCount").asLong(0),
                usage.path("candidatesTokenCount").asLong(0),
                usage.path("totalTokenCount").asLong(0));
    }

    private static String truncateForLog(String s) {
        if (s == null) return "";
        String oneLine = s.replaceAll("\\s+", " ");
        return oneLine.length() <= 300 ? oneLine : oneLine.substring(0, 300) + "…";
    }
}
