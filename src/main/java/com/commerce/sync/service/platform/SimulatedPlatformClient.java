package com.commerce.sync.service.platform;

import com.commerce.sync.domain.Observation;
import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.exception.PlatformApiException;
import com.commerce.sync.exception.ResourceNotFoundOnPlatformException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-in for a commerce platform.
 * <p>
 * Simulates:
 * - quantity and price lookups and updates
 * - outages and intermittent failures (for exercising retries and circuit breaking)
 * - network latency
 * <p>
 * In production each side would be a real platform client implementing the same two interfaces.
 */
@Slf4j
public class SimulatedPlatformClient implements PlatformReader, PlatformWriter {

    private final Platform platform;
    private final Clock clock;
    private final double failureRate;
    private final int latencyMs;
    private final Random random = new Random();

    private final Map<ResourceKey, BigDecimal> quantities = new ConcurrentHashMap<>();
    private final Map<ResourceKey, BigDecimal> prices = new ConcurrentHashMap<>();
    private final Set<ResourceKey> rejectedKeys = ConcurrentHashMap.newKeySet();
    private final AtomicInteger readCount = new AtomicInteger();
    private final AtomicInteger writeCount = new AtomicInteger();

    private volatile boolean simulateOutage = false;

    public SimulatedPlatformClient(Platform platform, Clock clock, double failureRate, int latencyMs) {
        this.platform = platform;
        this.clock = clock;
        this.failureRate = failureRate;
        this.latencyMs = latencyMs;
    }

    @Override
    public Platform platform() {
        return platform;
    }

    @Override
    public Observation getQuantity(ResourceKey resourceKey) {
        return read(resourceKey, quantities);
    }

    @Override
    public Observation getPrice(ResourceKey resourceKey) {
        return read(resourceKey, prices);
    }

    private Observation read(ResourceKey resourceKey, Map<ResourceKey, BigDecimal> store) {
        readCount.incrementAndGet();
        simulateLatency();

        if (simulateOutage) {
            throw new PlatformApiException(platform + " API is currently unavailable", platform,
                    resourceKey.value(), true);
        }
        if (random.nextDouble() < failureRate) {
            throw new PlatformApiException("Simulated network failure while contacting " + platform, platform,
                    resourceKey.value(), true);
        }

        BigDecimal value = store.get(resourceKey);
        if (value == null) {
            throw new ResourceNotFoundOnPlatformException(platform, resourceKey.value());
        }
        return Observation.of(resourceKey, platform, value, clock.instant());
    }

    @Override
    public WriteOutcome applyQuantity(ResourceKey resourceKey, BigDecimal quantity) {
        if (quantity.signum() < 0) {
            return WriteOutcome.fromHttpStatus(422, "quantity must not be negative");
        }
        return write(resourceKey, quantity, quantities);
    }

    @Override
    public WriteOutcome applyPrice(ResourceKey resourceKey, BigDecimal price) {
        if (price.signum() <= 0) {
            return WriteOutcome.fromHttpStatus(422, "price must be positive");
        }
        return write(resourceKey, price, prices);
    }

    private WriteOutcome write(ResourceKey resourceKey, BigDecimal value, Map<ResourceKey, BigDecimal> store) {
        writeCount.incrementAndGet();
        simulateLatency();

        // the caller gave up on this call; the value must not land
        if (Thread.currentThread().isInterrupted()) {
            throw new PlatformApiException("Write to " + platform + " abandoned after interrupt", platform,
                    resourceKey.value(), true);
        }

        if (simulateOutage) {
            return WriteOutcome.fromHttpStatus(503, platform + " API is currently unavailable");
        }
        if (random.nextDouble() < failureRate) {
            return WriteOutcome.fromHttpStatus(429, "rate limited by " + platform);
        }
        if (rejectedKeys.contains(resourceKey)) {
            return WriteOutcome.fromHttpStatus(400, "update rejected for " + resourceKey);
        }
        if (!isResolvable(resourceKey)) {
            return WriteOutcome.fromHttpStatus(404, resourceKey + " not found on " + platform);
        }
        store.put(resourceKey, value);
        log.debug("{} updated {} to {}", platform, resourceKey, value);
        return WriteOutcome.success();
    }

    @Override
    public boolean isResolvable(ResourceKey resourceKey) {
        return quantities.containsKey(resourceKey) || prices.containsKey(resourceKey);
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // Methods for testing/simulation control

    public void setQuantity(ResourceKey resourceKey, BigDecimal quantity) {
        quantities.put(resourceKey, quantity);
    }

    public void setPrice(ResourceKey resourceKey, BigDecimal price) {
        prices.put(resourceKey, price);
    }

    public BigDecimal quantityOf(ResourceKey resourceKey) {
        return quantities.get(resourceKey);
    }

    public BigDecimal priceOf(ResourceKey resourceKey) {
        return prices.get(resourceKey);
    }

    /**
     * Makes every later write for the key fail permanently, like a validation rejection.
     */
    public void rejectWrites(ResourceKey resourceKey) {
        rejectedKeys.add(resourceKey);
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("{} outage simulation set to: {}", platform, outage);
    }

    public int getReadCount() {
        return readCount.get();
    }

    public int getWriteCount() {
        return writeCount.get();
    }

    public void clear() {
        quantities.clear();
        prices.clear();
        rejectedKeys.clear();
        readCount.set(0);
        writeCount.set(0);
    }
}
