package com.commerce.sync.entity;

import com.commerce.sync.domain.Conflict.ConflictType;
import com.commerce.sync.domain.ResolutionStrategy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Conflict log: one row per resolution, with the evidence needed to re-derive it.
 */
@Entity
@Table(name = "conflict_log", indexes = {
        @Index(name = "idx_conflict_key", columnList = "resource_key"),
        @Index(name = "idx_conflict_strategy", columnList = "strategy")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, length = 36)
    private String runId;

    @Column(name = "resource_key", nullable = false, length = 100)
    private String resourceKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "conflict_type", nullable = false, length = 10)
    private ConflictType conflictType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ResolutionStrategy strategy;

    @Column(name = "resolved_value", precision = 19, scale = 4)
    private BigDecimal resolvedValue;

    @Column(name = "write_required", nullable = false)
    private boolean writeRequired;

    /**
     * Observations, ledger entries and numeric inputs as JSON.
     */
    @Lob
    @Column(name = "evidence")
    private String evidence;

    @Column(name = "resolved_at", nullable = false)
    private Instant resolvedAt;
}
