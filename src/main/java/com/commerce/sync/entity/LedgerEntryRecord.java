package com.commerce.sync.entity;

import com.commerce.sync.domain.LedgerEntry;
import com.commerce.sync.domain.LedgerEntry.LedgerKind;
import com.commerce.sync.domain.LedgerEntry.LedgerSource;
import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A change applied to a quantity or price, as written by the inventory transaction and price
 * history ledgers. This service only reads these rows.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
        @Index(name = "idx_ledger_key_kind_recorded", columnList = "resource_key, kind, recorded_at"),
        @Index(name = "idx_ledger_key_kind_source", columnList = "resource_key, kind, source")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_key", nullable = false, length = 100)
    private String resourceKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Platform platform;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LedgerKind kind;

    @Column(name = "previous_value", precision = 19, scale = 4)
    private BigDecimal previousValue;

    @Column(name = "new_value", nullable = false, precision = 19, scale = 4)
    private BigDecimal newValue;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LedgerSource source;

    @Column(length = 255)
    private String reason;

    public LedgerEntry toDomain() {
        return LedgerEntry.builder()
                .id(id)
                .resourceKey(ResourceKey.of(resourceKey))
                .platform(platform)
                .kind(kind)
                .previousValue(previousValue)
                .newValue(newValue)
                .recordedAt(recordedAt)
                .source(source)
                .reason(reason)
                .build();
    }
}
