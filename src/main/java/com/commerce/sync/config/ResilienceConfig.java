package com.commerce.sync.config;

import com.commerce.sync.service.resilience.RemoteCallGuard;
import com.commerce.sync.service.resilience.TransientFailureClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for Resilience4j circuit breakers and time limits on platform calls.
 * <p>
 * One circuit breaker per platform protects writes against a platform that keeps failing.
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Platform is failing, requests fail fast without a call
 * - HALF_OPEN: One trial call decides whether to close again
 */
@Configuration
public class ResilienceConfig {

    @Value("${sync.circuit-breaker.failure-threshold:5}")
    private int failureThreshold;

    @Value("${sync.circuit-breaker.cooldown:30s}")
    private Duration cooldown;

    @Value("${sync.platform.call-timeout:10s}")
    private Duration callTimeout;

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(TransientFailureClassifier classifier,
                                                         MeterRegistry meterRegistry) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // Open once the last N recorded calls all failed, i.e. N consecutive failures
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                // Time to wait before transitioning from OPEN to HALF_OPEN
                .waitDurationInOpenState(cooldown)
                // A single trial call in HALF_OPEN
                .permittedNumberOfCallsInHalfOpenState(1)
                // Permanent rejections say nothing about platform health
                .recordException(classifier::isTransient)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);
        return registry;
    }

    @Bean
    public TimeLimiter platformCallTimeLimiter() {
        return TimeLimiter.of("platform-call", TimeLimiterConfig.custom()
                .timeoutDuration(callTimeout)
                .cancelRunningFuture(true)
                .build());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService platformCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "platform-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public RemoteCallGuard remoteCallGuard(TimeLimiter platformCallTimeLimiter, ExecutorService platformCallExecutor) {
        return new RemoteCallGuard(platformCallTimeLimiter, platformCallExecutor);
    }
}
