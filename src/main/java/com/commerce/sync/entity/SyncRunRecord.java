package com.commerce.sync.entity;

import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.domain.SyncState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * History row for one finished sync run.
 * <p>
 * A COMPLETED run with {@code failedCount > 0} is a degraded run; a FAILED run never finished.
 */
@Entity
@Table(name = "sync_runs", indexes = {
        @Index(name = "idx_run_state", columnList = "state"),
        @Index(name = "idx_run_started_at", columnList = "started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, unique = true, length = 36)
    private String runId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncOperation operation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncState state;

    @Column(name = "requested_keys")
    private Integer requestedKeys;

    @Column(name = "contended_keys")
    private Integer contendedKeys;

    @Column(name = "resolution_count")
    private Integer resolutionCount;

    @Column(name = "total_items")
    @Builder.Default
    private Integer totalItems = 0;

    @Column(name = "succeeded_count")
    @Builder.Default
    private Integer succeededCount = 0;

    @Column(name = "failed_count")
    @Builder.Default
    private Integer failedCount = 0;

    @Column(name = "skipped_count")
    @Builder.Default
    private Integer skippedCount = 0;

    @Column(nullable = false)
    private boolean cancelled;

    @Column(name = "failure_cause", length = 500)
    private String failureCause;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "duration_ms")
    private Long durationMs;
}
