package com.ideia.contentgen.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Process-wide request pacing for Gemini calls.
 *
 * <p>Keeps a requests-per-minute budget in a synchronized minute window shared by every worker.
 * Call {@link #acquire()} before each request; it blocks until the current window has room.
 *
 * <p>Single-node only. Two processes against the same API key are already prevented by the
 * data-directory lock.
 */
public class GeminiRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(GeminiRateLimiter.class);
    private static final long MIN_SLEEP_MS = 10L;

    private final Object lock = new Object();
    private final int rpm;
    private long windowStartMs = alignToMinute(System.currentTimeMillis());
    private int requestsUsed = 0;

    public GeminiRateLimiter(int rpm) {
        this.rpm = Math.max(1, rpm);
    }

    public void acquire() throws InterruptedException {
        boolean logged = false;
        while (true) {
            long now = System.currentTimeMillis();
            long minuteStart = alignToMinute(now);
            long sleepMs;

            synchronized (lock) {
                if (minuteStart > windowStartMs) {
                    windowStartMs = minuteStart;
                    requestsUsed = 0;
                }
                if (requestsUsed + 1 <= rpm) {
                    requestsUsed += 1;
                    return;
                }
                long nextWindowStart = windowStartMs + TimeUnit.MINUTES.toMillis(1);
                sleepMs = Math.max(1L, nextWindowStart - now);
            }

            if (!logged) {
                log.info("Gemini RPM budget ({}) exhausted; waiting ~{} ms for the next window", rpm, sleepMs);
                logged = true;
            }
            // sleep outside the monitor so other workers can check the window
            Thread.sleep(Math.max(MIN_SLEEP_MS, Math.min(250L, sleepMs)));
        }
    }

    /** Brief pause after a 429 to avoid a retry stampede across workers. */
    public void onRateLimitHit() throws InterruptedException {
        Thread.sleep(Math.max(MIN_SLEEP_MS, 50L));
    }

    private static long alignToMinute(long epochMs) {
        long minute = TimeUnit.MILLISECONDS.toMinutes(epochMs);
        return TimeUnit.MINUTES.toMillis(minute);
    }
}
