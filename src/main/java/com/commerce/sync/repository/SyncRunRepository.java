package com.commerce.sync.repository;

import com.commerce.sync.domain.SyncState;
import com.commerce.sync.entity.SyncRunRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Run history, for dashboards and alerting.
 */
@Repository
public interface SyncRunRepository extends JpaRepository<SyncRunRecord, Long> {

    Optional<SyncRunRecord> findByRunId(String runId);

    List<SyncRunRecord> findTop20ByOrderByStartedAtDesc();

    /**
     * Runs in the given state with at least one failed item. With {@code COMPLETED} these are
     * the partially degraded runs.
     */
    List<SyncRunRecord> findByStateAndFailedCountGreaterThanOrderByStartedAtDesc(SyncState state, int failedCount);

    long countByState(SyncState state);

    long countByStateAndFailedCountGreaterThan(SyncState state, int failedCount);

    /**
     * Run counts grouped by state.
     */
    @Query("SELECT r.state, COUNT(r) FROM SyncRunRecord r GROUP BY r.state")
    List<Object[]> countGroupedByState();
}
