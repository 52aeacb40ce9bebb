package com.ideia.contentgen.service.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shrinks the requested batch size of one (category, kind) task when the model keeps failing to
 * deliver usable, novel items. The size never grows back within a run.
 *
 * <p>Step-down triggers:
 * <ul>
 *   <li>two unusable responses in a row (no text, unparsable, or an empty array)</li>
 *   <li>a batch that yields zero accepted items after validation and dedup</li>
 * </ul>
 */
public class AdaptiveBatchController {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveBatchController.class);

    public static final int MIN_BATCH = 2;
    static final int UNUSABLE_RESPONSES_BEFORE_STEP = 2;

    private final String taskName;
    private int dynamicBatchSize;
    private int consecutiveUnusable = 0;

    public AdaptiveBatchController(String taskName, int initialBatchSize) {
        this.taskName = taskName;
        this.dynamicBatchSize = Math.max(MIN_BATCH, initialBatchSize);
    }

    /**
     * Fixed step-down ladder: 41+ to 25, 26+ to 20, 21+ to 10, 11+ to 5, 6+ to 3, else 2.
     *
     * <p>Strictly decreasing above {@link #MIN_BATCH}. The floor is absolute: a size already at or
     * below it maps to {@link #MIN_BATCH}, which is the smallest size a task ever holds.
     */
    public static int nextLowerBatch(int current) {
        if (current <= MIN_BATCH) return MIN_BATCH;
        if (current > 40) return 25;
        if (current > 25) return 20;
        if (current > 20) return 10;
        if (current > 10) return 5;
        if (current > 5) return 3;
        return MIN_BATCH;
    }

    /** Items to ask for next: {@code max(2, min(remaining, dynamicBatchSize))}. */
    public int requestSize(int remaining) {
        return Math.max(MIN_BATCH, Math.min(remaining, dynamicBatchSize));
    }

    public void onUnusableResponse() {
        consecutiveUnusable++;
        if (consecutiveUnusable >= UNUSABLE_RESPONSES_BEFORE_STEP) {
            consecutiveUnusable = 0;
            stepDown("repeated unusable responses");
        }
    }

    public void onZeroYield() {
        consecutiveUnusable = 0;
        stepDown("batch yielded no new items");
    }

    public void onAccepted() {
        consecutiveUnusable = 0;
    }

    public int getDynamicBatchSize() {
        return dynamicBatchSize;
    }

    private void stepDown(String reason) {
        int before = dynamicBatchSize;
        dynamicBatchSize = nextLowerBatch(dynamicBatchSize);
        if (before != dynamicBatchSize) {
            log.info("[{}] {}: batch size {} -> {}", taskName, reason, before, dynamicBatchSize);
        }
    }
}
