package com.commerce.sync.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An applied change as recorded by one of the external ledgers (inventory transactions or
 * price history). Immutable; the core only reads these.
 */
@Value
@Builder
public class LedgerEntry {

    Long id;
    ResourceKey resourceKey;
    Platform platform;
    LedgerKind kind;
    BigDecimal previousValue;
    BigDecimal newValue;
    Instant recordedAt;
    LedgerSource source;
    String reason;

    public boolean isManual() {
        return source == LedgerSource.MANUAL;
    }

    public enum LedgerKind {
        QUANTITY,
        PRICE
    }

    /**
     * Who performed the recorded change.
     */
    public enum LedgerSource {
        SYSTEM,
        MANUAL,
        WEBHOOK
    }
}
