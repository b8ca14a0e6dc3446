package com.commerce.sync.entity;

import com.commerce.sync.domain.SyncOperation;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last time a resource was fully synchronized for one operation.
 */
@Entity
@Table(name = "sync_checkpoints", uniqueConstraints = {
        @UniqueConstraint(name = "uk_checkpoint_key_operation", columnNames = {"resource_key", "operation"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_key", nullable = false, length = 100)
    private String resourceKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncOperation operation;

    @Column(name = "last_synced_at", nullable = false)
    private Instant lastSyncedAt;

    @Version
    private Long version;
}
