package com.commerce.sync.controller;

import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.domain.SyncRun;
import com.commerce.sync.domain.SyncState;
import com.commerce.sync.dto.SyncRunRequest;
import com.commerce.sync.dto.SyncRunResponse;
import com.commerce.sync.dto.SyncStats;
import com.commerce.sync.entity.ConflictRecord;
import com.commerce.sync.entity.SyncRunRecord;
import com.commerce.sync.repository.ConflictRecordRepository;
import com.commerce.sync.repository.SyncRunRepository;
import com.commerce.sync.service.SyncOrchestrator;
import com.commerce.sync.service.SyncRunRecorder;
import com.commerce.sync.service.catalog.ProductCatalog;
import com.commerce.sync.service.lock.LockManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for sync operations.
 * <p>
 * Provides endpoints for:
 * - Triggering a run manually
 * - Cancelling an in-flight run
 * - Viewing run history, degraded runs and statistics
 * - Viewing the conflict log of a resource
 * - Inspecting leases
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sync", description = "Inventory and price synchronization API")
public class SyncController {

    private final SyncOrchestrator orchestrator;
    private final SyncRunRecorder recorder;
    private final SyncRunRepository runRepository;
    private final ConflictRecordRepository conflictRepository;
    private final ProductCatalog catalog;
    private final LockManager lockManager;

    @Operation(
            summary = "Trigger a sync run",
            description = "Runs inventory or price synchronization for the given resources, or for every active catalog resource when none are given. Returns once the run has finished."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run finished (COMPLETED, SKIPPED or FAILED)",
                    content = @Content(schema = @Schema(implementation = SyncRunResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing operation or blank resource key")
    })
    @PostMapping("/run")
    public ResponseEntity<SyncRunResponse> triggerRun(@RequestBody SyncRunRequest request) {
        if (request.getOperation() == null) {
            throw new IllegalArgumentException("operation is required");
        }
        List<String> keys = request.getResourceKeys() == null || request.getResourceKeys().isEmpty()
                ? catalog.activeResourceKeys().stream().map(ResourceKey::value).collect(Collectors.toList())
                : request.getResourceKeys();
        log.info("Manual {} sync triggered via API for {} resource(s)", request.getOperation(), keys.size());
        SyncRun run = orchestrator.run(keys, request.getOperation());
        return ResponseEntity.ok(SyncRunResponse.from(run));
    }

    @Operation(
            summary = "Cancel a run",
            description = "Stops an in-flight run from dispatching further write chunks. Chunks already dispatched complete."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Cancellation requested"),
            @ApiResponse(responseCode = "404", description = "No such run in flight on this instance")
    })
    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<Void> cancelRun(@Parameter(description = "Run ID") @PathVariable String runId) {
        return orchestrator.cancel(runId)
                ? ResponseEntity.accepted().build()
                : ResponseEntity.notFound().build();
    }

    @Operation(summary = "Recent runs", description = "Returns the 20 most recent finished runs.")
    @GetMapping("/runs/recent")
    public ResponseEntity<List<SyncRunRecord>> getRecentRuns() {
        return ResponseEntity.ok(runRepository.findTop20ByOrderByStartedAtDesc());
    }

    @Operation(
            summary = "Degraded runs",
            description = "Returns runs that completed with failed items. These are partial degradations, distinct from FAILED runs."
    )
    @GetMapping("/runs/degraded")
    public ResponseEntity<List<SyncRunRecord>> getDegradedRuns() {
        return ResponseEntity.ok(runRepository.findByStateAndFailedCountGreaterThanOrderByStartedAtDesc(
                SyncState.COMPLETED, 0));
    }

    @Operation(
            summary = "Sync statistics",
            description = "Run counts per state, degraded runs, and conflicts per strategy over the last N days."
    )
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = SyncStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<SyncStats> getStats(
            @Parameter(description = "Conflict window in days") @RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(recorder.getStats(orchestrator.activeRunIds(), days));
    }

    @Operation(
            summary = "Conflict history",
            description = "Returns the 50 most recent conflict resolutions for a resource, with their evidence."
    )
    @GetMapping("/conflicts/{resourceKey}")
    public ResponseEntity<List<ConflictRecord>> getConflictHistory(
            @Parameter(description = "Resource key (SKU)") @PathVariable String resourceKey) {
        return ResponseEntity.ok(conflictRepository.findTop50ByResourceKeyOrderByResolvedAtDesc(
                ResourceKey.of(resourceKey).value()));
    }

    @Operation(
            summary = "Lease status",
            description = "Advisory check whether a lease is currently held for a resource and operation."
    )
    @GetMapping("/locks/{operation}/{resourceKey}")
    public ResponseEntity<Map<String, Object>> getLockStatus(
            @Parameter(description = "INVENTORY or PRICE") @PathVariable SyncOperation operation,
            @Parameter(description = "Resource key (SKU)") @PathVariable String resourceKey) {
        ResourceKey key = ResourceKey.of(resourceKey);
        return ResponseEntity.ok(Map.of(
                "resourceKey", key.value(),
                "operation", operation,
                "held", lockManager.isHeld(key, operation),
                "lockKey", LockManager.lockKey(key, operation)
        ));
    }
}
