package com.commerce.sync.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Exclusive, time-bounded ownership of one (resource, operation) pair.
 * A lease past its expiry is treated as absent whether or not it was released.
 */
@Value
public class Lease {

    ResourceKey resourceKey;
    SyncOperation operation;
    String lockKey;
    String ownerToken;
    Instant acquiredAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
