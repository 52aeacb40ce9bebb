package com.ideia.contentgen.service.generation;

import com.ideia.contentgen.model.ContentKind;
import com.ideia.contentgen.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link ModelInvoker} through the retry / backoff / model-fallback state machine.
 *
 * <p>State per call: attempt number, current model, whether the fallback was used, and total
 * backoff slept. The loop moves to the fallback model at most once, when the next attempt is the
 * policy's fallback attempt and the primary model is still in use.
 */
public class RetryingGenerationClient implements GenerationClient {
    private static final Logger log = LoggerFactory.getLogger(RetryingGenerationClient.class);

    private final ModelInvoker invoker;
    private final RetryPolicy policy;
    private final String primaryModel;
    private final String fallbackModel;
    private final Sleeper sleeper;

    public RetryingGenerationClient(ModelInvoker invoker, RetryPolicy policy,
                                    String primaryModel, String fallbackModel, Sleeper sleeper) {
        this.invoker = invoker;
        this.policy = policy;
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
        this.sleeper = sleeper;
    }

    static final class AttemptState {
        int attempt = 1;
        String model;
        boolean fallbackUsed = false;
        long backoffMs = 0L;

        AttemptState(String model) {
            this.model = model;
        }
    }

    @Override
    public String primaryModel() {
        return primaryModel;
    }

    @Override
    public String generate(ContentKind kind, String prompt, int count) {
        AttemptState state = new AttemptState(primaryModel);
        while (true) {
            try {
                String text = invoker.invoke(state.model, prompt, ResponseSchemas.forKind(kind));
                if (text == null || text.isBlank()) {
                    log.warn("Model {} returned empty text for {} x{}", state.model, count, kind.getLabel());
                    return null;
                }
                if (state.attempt > 1) {
                    log.info("Generation succeeded on attempt {} with {} after {} ms backoff",
                            state.attempt, state.model, state.backoffMs);
                }
                return text;
            } catch (GenerationServiceException e) {
                Integer status = e.getStatus();
                if (state.attempt >= policy.getMaxAttempts() || !policy.isRetriable(status, state.attempt)) {
                    log.error("Generation failed for good (status={}, attempt {}/{}, model {}): {}",
                            status, state.attempt, policy.getMaxAttempts(), state.model, e.getMessage());
                    return null;
                }
                long delay = policy.backoffDelayMs(state.attempt);
                log.warn("Generation error (status={}) on {}. Retrying in {} ms (attempt {}/{})",
                        status, state.model, delay, state.attempt, policy.getMaxAttempts());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while backing off; giving up on this batch");
                    return null;
                }
                state.backoffMs += delay;
                state.attempt++;
                if (shouldSwitch(state)) {
                    log.warn("Switching from {} to fallback model {} for attempts {}-{}",
                            state.model, fallbackModel, state.attempt, policy.getMaxAttempts());
                    state.model = fallbackModel;
                    state.fallbackUsed = true;
                }
            }
        }
    }

    private boolean shouldSwitch(AttemptState state) {
        return !state.fallbackUsed
                && state.attempt == policy.fallbackAttempt()
                && primaryModel.equals(state.model)
                && fallbackModel != null && !fallbackModel.isBlank()
                && !fallbackModel.equals(primaryModel);
    }
}
