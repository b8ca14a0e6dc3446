package com.commerce.sync.service.lock;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local coordination store for single-instance deployments and tests.
 * Expiry is evaluated lazily on every access against the injected clock.
 */
@Slf4j
public class InMemoryCoordinationStore implements CoordinationStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCoordinationStore(Clock clock) {
        this.clock = clock;
        log.warn("Using in-memory coordination store; leases are not shared between processes");
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean created = new AtomicBoolean(false);
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            created.set(true);
            return new Entry(value, now.plus(ttl));
        });
        return created.get();
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public boolean exists(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return false;
        }
        return true;
    }

    @Override
    public boolean deleteIfMatches(String key, String expectedValue) {
        Instant now = clock.instant();
        AtomicBoolean deleted = new AtomicBoolean(false);
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (existing.getValue().equals(expectedValue)) {
                deleted.set(true);
                return null;
            }
            return existing;
        });
        return deleted.get();
    }

    @Value
    private static class Entry {
        String value;
        Instant expiresAt;

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
