package com.example.offshore.allocation.service;

import java.time.Duration;

/**
 * Pacing for a backfill run: records per batch, pause between batches, and how many times a failed batch
 * transaction is attempted before the run halts.
 */
public record BackfillSchedule(int batchSize, Duration interBatchDelay, int maxBatchAttempts) {

    public static final int DEFAULT_BATCH_SIZE = 1000;

    public BackfillSchedule {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive but was " + batchSize);
        }
        interBatchDelay = interBatchDelay == null || interBatchDelay.isNegative() ? Duration.ZERO : interBatchDelay;
        maxBatchAttempts = Math.max(1, maxBatchAttempts);
    }

    public BackfillSchedule withBatchSize(int size) {
        return new BackfillSchedule(size, interBatchDelay, maxBatchAttempts);
    }
}
