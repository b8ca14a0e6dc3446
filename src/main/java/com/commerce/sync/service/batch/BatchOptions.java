package com.commerce.sync.service.batch;

import com.commerce.sync.service.resilience.BackoffPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Knobs for one batch execution. Defaults follow the platforms' published rate limits.
 */
@Value
@Builder(toBuilder = true)
public class BatchOptions {

    @Builder.Default
    int batchSize = 100;

    @Builder.Default
    Duration interBatchDelay = Duration.ofSeconds(1);

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    boolean failFast = false;

    @Builder.Default
    Duration backoffBase = Duration.ofSeconds(1);

    @Builder.Default
    Duration backoffCap = Duration.ofSeconds(30);

    @Builder.Default
    double jitterFactor = 0.5;

    public static BatchOptions defaults() {
        return BatchOptions.builder().build();
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(backoffBase, backoffCap, jitterFactor);
    }

    void validate() {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
        }
        if (interBatchDelay.isNegative()) {
            throw new IllegalArgumentException("interBatchDelay must not be negative: " + interBatchDelay);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }
}
