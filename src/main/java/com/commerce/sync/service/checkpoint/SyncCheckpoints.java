package com.commerce.sync.service.checkpoint;

import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;

import java.time.Instant;
import java.util.Optional;

/**
 * Remembers when each resource was last fully synchronized. The quantity policy compares
 * ledger entries against this time.
 */
public interface SyncCheckpoints {

    Optional<Instant> lastSyncedAt(ResourceKey resourceKey, SyncOperation operation);

    void markSynced(ResourceKey resourceKey, SyncOperation operation, Instant at);
}
