package com.commerce.sync.repository;

import com.commerce.sync.domain.LedgerEntry.LedgerKind;
import com.commerce.sync.domain.LedgerEntry.LedgerSource;
import com.commerce.sync.entity.LedgerEntryRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryRecord, Long> {

    /**
     * Entries strictly after {@code since}, newest first.
     */
    List<LedgerEntryRecord> findByResourceKeyAndKindAndRecordedAtAfterOrderByRecordedAtDesc(
            String resourceKey, LedgerKind kind, Instant since);

    /**
     * Newest entry of a given source recorded after {@code since}. Used to find recent manual overrides.
     */
    Optional<LedgerEntryRecord> findFirstByResourceKeyAndKindAndSourceAndRecordedAtAfterOrderByRecordedAtDesc(
            String resourceKey, LedgerKind kind, LedgerSource source, Instant since);
}
