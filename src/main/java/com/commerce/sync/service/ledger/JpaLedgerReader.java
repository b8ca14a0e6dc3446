package com.commerce.sync.service.ledger;

import com.commerce.sync.domain.LedgerEntry;
import com.commerce.sync.domain.LedgerEntry.LedgerKind;
import com.commerce.sync.domain.LedgerEntry.LedgerSource;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.entity.LedgerEntryRecord;
import com.commerce.sync.exception.LedgerAccessException;
import com.commerce.sync.repository.LedgerEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ledger reader over the {@code ledger_entries} table, scoped to one {@link LedgerKind}.
 */
@Slf4j
public class JpaLedgerReader implements LedgerReader {

    private final LedgerEntryRepository repository;
    private final LedgerKind kind;
    private final Clock clock;

    public JpaLedgerReader(LedgerEntryRepository repository, LedgerKind kind, Clock clock) {
        this.repository = repository;
        this.kind = kind;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntry> findLatestSince(ResourceKey resourceKey, Instant since) {
        try {
            List<LedgerEntry> entries = repository
                    .findByResourceKeyAndKindAndRecordedAtAfterOrderByRecordedAtDesc(resourceKey.value(), kind, since)
                    .stream()
                    .map(LedgerEntryRecord::toDomain)
                    .collect(Collectors.toList());
            log.debug("{} {} ledger entries for {} since {}", entries.size(), kind, resourceKey, since);
            return entries;
        } catch (DataAccessException e) {
            throw new LedgerAccessException("Failed to read " + kind + " ledger for " + resourceKey, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findManualOverride(ResourceKey resourceKey, Duration within) {
        Instant since = clock.instant().minus(within);
        try {
            return repository
                    .findFirstByResourceKeyAndKindAndSourceAndRecordedAtAfterOrderByRecordedAtDesc(
                            resourceKey.value(), kind, LedgerSource.MANUAL, since)
                    .map(LedgerEntryRecord::toDomain);
        } catch (DataAccessException e) {
            throw new LedgerAccessException("Failed to read manual overrides for " + resourceKey, e);
        }
    }
}
