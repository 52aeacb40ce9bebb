package com.ideia.contentgen.service.generation;

import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Retry classification and backoff for generation calls.
 *
 * <ul>
 *   <li>Retriable statuses: 408, 409, 425, 429 and every 5xx.</li>
 *   <li>No status (timeout, connection reset): retriable while {@code attempt <= maxAttempts / 2}.</li>
 *   <li>Delay before the next attempt: {@code base * 2^(attempt-1) + jitter}, jitter in [0, 1000) ms.</li>
 *   <li>The fallback model takes over from attempt {@code ceil(maxAttempts / 2)}.</li>
 * </ul>
 */
public class RetryPolicy {
    static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 409, 425, 429);
    static final long MAX_JITTER_MS = 1000L;

    private final int maxAttempts;
    private final long baseDelayMs;
    private final LongSupplier jitter;

    public RetryPolicy(int maxAttempts, long baseDelayMs) {
        this(maxAttempts, baseDelayMs, () -> ThreadLocalRandom.current().nextLong(MAX_JITTER_MS));
    }

    public RetryPolicy(int maxAttempts, long baseDelayMs, LongSupplier jitter) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitter = jitter;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isRetriable(Integer status, int attempt) {
        if (status == null) return attempt <= maxAttempts / 2;
        return TRANSIENT_STATUSES.contains(status) || (status >= 500 && status <= 599);
    }

    public long backoffDelayMs(int attempt) {
        int exp = Math.max(0, Math.min(attempt - 1, 20));
        return baseDelayMs * (1L << exp) + Math.max(0L, jitter.getAsLong());
    }

    public int fallbackAttempt() {
        return (maxAttempts + 1) / 2;
    }
}
