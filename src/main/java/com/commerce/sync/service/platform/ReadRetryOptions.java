package com.commerce.sync.service.platform;

import com.commerce.sync.service.resilience.BackoffPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Retry settings for platform reads.
 */
@Value
@Builder
public class ReadRetryOptions {

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration backoffBase = Duration.ofSeconds(1);

    @Builder.Default
    Duration backoffCap = Duration.ofSeconds(60);

    @Builder.Default
    double jitterFactor = 0.5;

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(backoffBase, backoffCap, jitterFactor);
    }
}
