package com.commerce.sync.service.lock;

import com.commerce.sync.domain.Lease;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.exception.CoordinationStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Grants exclusive, time-bounded leases on {@code (resource, operation)} pairs across every
 * process sharing the coordination store.
 * <p>
 * Acquisition is one atomic conditional set, so of N concurrent callers exactly one wins.
 * Leases always carry a TTL and disappear on their own if the holder dies. Release is
 * best-effort: a failed release is logged and the TTL bounds how long the lease lingers.
 */
@Slf4j
public class LockManager {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(120);

    private static final String KEY_PREFIX = "sync:lock:";

    private final CoordinationStore store;
    private final Clock clock;
    private final String instanceId;

    public LockManager(CoordinationStore store, Clock clock, String instanceId) {
        this.store = store;
        this.clock = clock;
        this.instanceId = instanceId;
    }

    public static String lockKey(ResourceKey resourceKey, SyncOperation operation) {
        return KEY_PREFIX + resourceKey.value() + ":" + operation.getLockName();
    }

    /**
     * Attempts to take the lease.
     *
     * @return the lease, or empty if someone else holds it
     * @throws CoordinationStoreException if the store cannot be reached; never reported as contention
     */
    public Optional<Lease> tryAcquire(ResourceKey resourceKey, SyncOperation operation, Duration ttl) {
        requirePositive(ttl);
        String key = lockKey(resourceKey, operation);
        String token = instanceId + ":" + UUID.randomUUID();
        Instant now = clock.instant();

        if (!store.setIfAbsent(key, token, ttl)) {
            log.debug("Lease {} is held elsewhere", key);
            return Optional.empty();
        }
        log.debug("Acquired lease {} for {}", key, ttl);
        return Optional.of(new Lease(resourceKey, operation, key, token, now, now.plus(ttl)));
    }

    public boolean acquire(ResourceKey resourceKey, SyncOperation operation, Duration ttl) {
        return tryAcquire(resourceKey, operation, ttl).isPresent();
    }

    public boolean acquire(ResourceKey resourceKey, SyncOperation operation) {
        return acquire(resourceKey, operation, DEFAULT_TTL);
    }

    /**
     * Releases a lease this instance holds. Only deletes the entry while it still carries the
     * lease's owner token, so a lease that expired and was taken by another run is left alone.
     */
    public void release(Lease lease) {
        try {
            if (!store.deleteIfMatches(lease.getLockKey(), lease.getOwnerToken())) {
                log.warn("Lease {} had already expired or changed owner before release", lease.getLockKey());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release lease {}; it will expire by TTL: {}", lease.getLockKey(), e.getMessage());
        }
    }

    /**
     * Unconditional best-effort release, for operators clearing a lease they do not hold.
     */
    public void release(ResourceKey resourceKey, SyncOperation operation) {
        String key = lockKey(resourceKey, operation);
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            log.warn("Failed to release lease {}; it will expire by TTL: {}", key, e.getMessage());
        }
    }

    /**
     * Advisory only: the answer can be stale by the time the caller acts on it.
     */
    public boolean isHeld(ResourceKey resourceKey, SyncOperation operation) {
        return store.exists(lockKey(resourceKey, operation));
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Lease TTL must be positive: " + ttl);
        }
    }
}
