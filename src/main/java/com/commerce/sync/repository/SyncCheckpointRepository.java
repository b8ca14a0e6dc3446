package com.commerce.sync.repository;

import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.entity.SyncCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SyncCheckpointRepository extends JpaRepository<SyncCheckpoint, Long> {

    Optional<SyncCheckpoint> findByResourceKeyAndOperation(String resourceKey, SyncOperation operation);
}
