package com.commerce.sync.domain;

import com.commerce.sync.domain.Conflict.ConflictType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of conflict handling.
 * <p>
 * Carries the observations, the ledger entries consulted and every numeric input the decision
 * used, so the same result can be re-derived from the record alone. Persisting it is the
 * caller's job.
 */
@Value
@Builder
public class Resolution {

    ResourceKey resourceKey;
    ConflictType conflictType;
    ResolutionStrategy strategy;

    /**
     * The authoritative value. For {@link ResolutionStrategy#IGNORE} this is the value already in place.
     */
    BigDecimal resolvedValue;

    boolean writeRequired;

    @Singular
    List<Observation> observations;

    @Singular
    List<LedgerEntry> ledgerEntries;

    @Singular
    Map<String, BigDecimal> inputs;

    /**
     * Last sync time the ledger was compared against, when one was known.
     */
    Instant referenceTime;

    Instant resolvedAt;
}
