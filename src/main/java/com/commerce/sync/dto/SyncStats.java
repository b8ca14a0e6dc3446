package com.commerce.sync.dto;

import com.commerce.sync.domain.SyncState;
import lombok.Builder;
import lombok.Data;

import java.util.Map;
import java.util.Set;

/**
 * Run and conflict counts for dashboards. Degraded runs (completed with failed items) are
 * counted separately from FAILED runs. Conflict counts cover the last {@code conflictWindowDays} days.
 */
@Data
@Builder
public class SyncStats {

    private Map<SyncState, Long> runsByState;
    private long degradedRuns;
    private Map<String, Long> conflictsByStrategy;
    private int conflictWindowDays;
    private Set<String> activeRunIds;
}
