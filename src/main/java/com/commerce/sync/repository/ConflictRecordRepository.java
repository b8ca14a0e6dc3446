package com.commerce.sync.repository;

import com.commerce.sync.entity.ConflictRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ConflictRecordRepository extends JpaRepository<ConflictRecord, Long> {

    List<ConflictRecord> findByRunIdOrderByResolvedAtAsc(String runId);

    List<ConflictRecord> findTop50ByResourceKeyOrderByResolvedAtDesc(String resourceKey);

    /**
     * Conflict counts grouped by resolution strategy, for conflicts resolved at or after {@code since}.
     */
    @Query("SELECT c.strategy, COUNT(c) FROM ConflictRecord c WHERE c.resolvedAt >= :since GROUP BY c.strategy")
    List<Object[]> countGroupedByStrategy(@Param("since") Instant since);
}
