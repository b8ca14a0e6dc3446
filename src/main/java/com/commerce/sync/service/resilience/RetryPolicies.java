package com.commerce.sync.service.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single place that builds retry policies for remote calls. The platform read path and the
 * batch executor both retry through here, with the same transient-vs-permanent classification.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RetryPolicies {

    private final TransientFailureClassifier classifier;

    /**
     * @param maxRetries retries after the first attempt; zero disables retrying
     */
    public Retry create(String name, int maxRetries, BackoffPolicy backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(attempt -> backoff.delayFor(attempt).toMillis())
                .retryOnException(classifier::isTransient)
                .build();

        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retry {} of {} for {} in {} ms: {}",
                event.getNumberOfRetryAttempts(), maxRetries, name,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
