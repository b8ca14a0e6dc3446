package com.commerce.sync.service.ledger;

import com.commerce.sync.domain.LedgerEntry;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.exception.LedgerAccessException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side of one ledger (inventory transactions or price history).
 * Failures surface as {@link LedgerAccessException}.
 */
public interface LedgerReader {

    /**
     * Entries recorded strictly after {@code since}, newest first.
     */
    List<LedgerEntry> findLatestSince(ResourceKey resourceKey, Instant since);

    /**
     * Newest manual change recorded within {@code within} of now, if any.
     */
    Optional<LedgerEntry> findManualOverride(ResourceKey resourceKey, Duration within);
}
