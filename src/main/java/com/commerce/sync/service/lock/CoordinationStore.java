package com.commerce.sync.service.lock;

import com.commerce.sync.exception.CoordinationStoreException;

import java.time.Duration;

/**
 * Shared key-value store used only for leases.
 * <p>
 * Implementations must make {@link #setIfAbsent} atomic across every process sharing the store,
 * and must bound every call with a timeout. Failures surface as {@link CoordinationStoreException}.
 */
public interface CoordinationStore {

    /**
     * Sets {@code key} to {@code value} with the given expiry only if no live value exists.
     *
     * @return true if this call created the entry
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void delete(String key);

    boolean exists(String key);

    /**
     * Deletes {@code key} only while it still holds {@code expectedValue}, atomically.
     *
     * @return true if the entry was deleted
     */
    boolean deleteIfMatches(String key, String expectedValue);
}
