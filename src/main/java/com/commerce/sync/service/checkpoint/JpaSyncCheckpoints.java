package com.commerce.sync.service.checkpoint;

import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.entity.SyncCheckpoint;
import com.commerce.sync.repository.SyncCheckpointRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaSyncCheckpoints implements SyncCheckpoints {

    private final SyncCheckpointRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> lastSyncedAt(ResourceKey resourceKey, SyncOperation operation) {
        return repository.findByResourceKeyAndOperation(resourceKey.value(), operation)
                .map(SyncCheckpoint::getLastSyncedAt);
    }

    /**
     * Never moves a checkpoint backwards.
     */
    @Override
    @Transactional
    public void markSynced(ResourceKey resourceKey, SyncOperation operation, Instant at) {
        SyncCheckpoint checkpoint = repository.findByResourceKeyAndOperation(resourceKey.value(), operation)
                .orElseGet(() -> SyncCheckpoint.builder()
                        .resourceKey(resourceKey.value())
                        .operation(operation)
                        .build());
        if (checkpoint.getLastSyncedAt() == null || checkpoint.getLastSyncedAt().isBefore(at)) {
            checkpoint.setLastSyncedAt(at);
            repository.save(checkpoint);
        }
    }
}
