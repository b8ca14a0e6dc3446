package com.commerce.sync.service.resilience;

import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a cap and proportional jitter.
 * <pre>
 * floor(n) = min(base * 2^(n-1), cap)
 * delay(n) = min(cap, floor(n) * (1 + jitterFactor * u)),  u in [0, 1)
 * </pre>
 * Every delay therefore lies between its floor and the cap.
 */
@Value
public class BackoffPolicy {

    Duration base;
    Duration cap;
    double jitterFactor;

    public BackoffPolicy(Duration base, Duration cap, double jitterFactor) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Backoff base must be positive: " + base);
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff cap " + cap + " is below base " + base);
        }
        if (jitterFactor < 0) {
            throw new IllegalArgumentException("Jitter factor must not be negative: " + jitterFactor);
        }
        this.base = base;
        this.cap = cap;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Lower bound of the wait before retry {@code attempt} (1-based).
     */
    public Duration floorFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Retry attempts are 1-based: " + attempt);
        }
        long capMillis = cap.toMillis();
        long delay = base.toMillis();
        for (int i = 1; i < attempt && delay < capMillis; i++) {
            delay *= 2;
        }
        return Duration.ofMillis(Math.min(delay, capMillis));
    }

    public Duration delayFor(int attempt) {
        return delayFor(attempt, ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random a sample from [0, 1)
     */
    public Duration delayFor(int attempt, double random) {
        long floor = floorFor(attempt).toMillis();
        long jittered = floor + Math.round(floor * jitterFactor * random);
        return Duration.ofMillis(Math.min(cap.toMillis(), jittered));
    }
}
