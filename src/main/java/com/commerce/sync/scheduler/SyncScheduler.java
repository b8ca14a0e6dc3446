package com.commerce.sync.scheduler;

import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.domain.SyncRun;
import com.commerce.sync.service.SyncOrchestrator;
import com.commerce.sync.service.batch.BatchRunReport;
import com.commerce.sync.service.catalog.ProductCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Periodic sync triggers.
 * <p>
 * Uses fixedDelay so a tick never starts while the previous one in this process is still
 * running. Overlap with other instances is handled by leases, not by the scheduler.
 * <p>
 * Default: inventory every 5 minutes, prices every 30 minutes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncScheduler {

    static final double FAILURE_ALERT_RATIO = 0.1;

    private final SyncOrchestrator orchestrator;
    private final ProductCatalog catalog;

    @Value("${sync.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${sync.scheduler.inventory-interval-ms:300000}",
            initialDelayString = "${sync.scheduler.initial-delay-ms:30000}")
    public void runInventorySync() {
        runScheduled(SyncOperation.INVENTORY);
    }

    @Scheduled(fixedDelayString = "${sync.scheduler.price-interval-ms:1800000}",
            initialDelayString = "${sync.scheduler.initial-delay-ms:30000}")
    public void runPriceSync() {
        runScheduled(SyncOperation.PRICE);
    }

    void runScheduled(SyncOperation operation) {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping {} sync", operation);
            return;
        }
        List<String> keys = catalog.activeResourceKeys().stream()
                .map(ResourceKey::value)
                .collect(Collectors.toList());
        if (keys.isEmpty()) {
            log.debug("No active resources in catalog, skipping {} sync", operation);
            return;
        }

        try {
            SyncRun run = orchestrator.run(keys, operation);
            logResult(run);
        } catch (Exception e) {
            log.error("Scheduled {} sync failed with unexpected error", operation, e);
        }
    }

    private void logResult(SyncRun run) {
        switch (run.getState()) {
            case SKIPPED -> log.info("Scheduled {} sync {} skipped: already running elsewhere",
                    run.getOperation(), run.getRunId());
            case FAILED -> log.error("Scheduled {} sync {} failed: {}", run.getOperation(), run.getRunId(),
                    run.getFailureCause());
            default -> {
                BatchRunReport report = run.getReport();
                log.info("Scheduled {} sync {} completed in {}ms: {} conflicts, {} written, {} failed, {} skipped",
                        run.getOperation(), run.getRunId(), run.getDuration().toMillis(),
                        run.getResolutions().size(), report.getSucceeded(), report.getFailed(), report.getSkipped());

                // Alert if too many items failed
                if (report.getTotal() > 0 && report.failureRatio() > FAILURE_ALERT_RATIO) {
                    log.warn("High failure rate in {} sync {}: {} failed out of {}", run.getOperation(),
                            run.getRunId(), report.getFailed(), report.getTotal());
                }
            }
        }
    }
}
