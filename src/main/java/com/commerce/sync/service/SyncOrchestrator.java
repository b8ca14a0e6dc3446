package com.commerce.sync.service;

import com.commerce.sync.domain.Lease;
import com.commerce.sync.domain.Observation;
import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.PricingTerms;
import com.commerce.sync.domain.Resolution;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.domain.SyncRun;
import com.commerce.sync.domain.SyncState;
import com.commerce.sync.exception.PlatformUnavailableException;
import com.commerce.sync.service.batch.BatchExecutor;
import com.commerce.sync.service.batch.BatchItem;
import com.commerce.sync.service.batch.BatchOptions;
import com.commerce.sync.service.batch.BatchRunReport;
import com.commerce.sync.service.batch.CancellationSignal;
import com.commerce.sync.service.batch.ItemFailure;
import com.commerce.sync.service.catalog.ProductCatalog;
import com.commerce.sync.service.checkpoint.SyncCheckpoints;
import com.commerce.sync.service.conflict.ConflictResolver;
import com.commerce.sync.service.lock.LockManager;
import com.commerce.sync.service.platform.PlatformReadService;
import com.commerce.sync.service.platform.ReadResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Drives one sync run through its lifecycle:
 * <pre>
 * IDLE -> LOCKING -> READING -> RESOLVING -> WRITING -> COMPLETED
 * </pre>
 * A run that cannot lock any requested resource ends SKIPPED without reading anything.
 * Infrastructure failures (coordination store, ledger, both platforms unreachable) end it FAILED.
 * Leases taken by a run are always released before {@link #run} returns.
 * <p>
 * Concurrent runs are safe: the lease is the only guard, so two orchestrators in different
 * processes behave the same as two calls in one.
 */
@Slf4j
public class SyncOrchestrator {

    static final String SINGLE_OBSERVATION = "single_observation";

    private final LockManager lockManager;
    private final PlatformReadService readService;
    private final ConflictResolver conflictResolver;
    private final BatchExecutor batchExecutor;
    private final ProductCatalog catalog;
    private final SyncCheckpoints checkpoints;
    private final List<SyncEventListener> listeners;
    private final BatchOptions batchOptions;
    private final Duration leaseTtl;
    private final Clock clock;

    private final Map<String, CancellationSignal> activeRuns = new ConcurrentHashMap<>();

    public SyncOrchestrator(LockManager lockManager,
                            PlatformReadService readService,
                            ConflictResolver conflictResolver,
                            BatchExecutor batchExecutor,
                            ProductCatalog catalog,
                            SyncCheckpoints checkpoints,
                            List<SyncEventListener> listeners,
                            BatchOptions batchOptions,
                            Duration leaseTtl,
                            Clock clock) {
        this.lockManager = lockManager;
        this.readService = readService;
        this.conflictResolver = conflictResolver;
        this.batchExecutor = batchExecutor;
        this.catalog = catalog;
        this.checkpoints = checkpoints;
        this.listeners = List.copyOf(listeners);
        this.batchOptions = batchOptions;
        this.leaseTtl = leaseTtl;
        this.clock = clock;
    }

    /**
     * Synchronizes {@code operation} for the given resources.
     *
     * @param rawKeys resource keys in any case or spacing; duplicates after normalization are ignored
     * @return the finished run, in a terminal state
     * @throws IllegalArgumentException if no keys are given or a key is blank
     */
    public SyncRun run(Collection<String> rawKeys, SyncOperation operation) {
        List<ResourceKey> keys = normalize(rawKeys);
        SyncRun run = new SyncRun(UUID.randomUUID().toString(), operation, keys, clock.instant());
        CancellationSignal signal = new CancellationSignal();
        activeRuns.put(run.getRunId(), signal);
        List<Lease> leases = new ArrayList<>();

        log.info("Starting {} sync run {} for {} resource(s)", operation, run.getRunId(), keys.size());
        try {
            transition(run, SyncState.LOCKING);
            for (ResourceKey key : keys) {
                Optional<Lease> lease = lockManager.tryAcquire(key, operation, leaseTtl);
                if (lease.isPresent()) {
                    leases.add(lease.get());
                } else {
                    run.addContendedKey(key);
                }
            }
            if (leases.isEmpty()) {
                log.info("Sync run {} skipped: every requested {} lease is held by another run",
                        run.getRunId(), operation);
                transition(run, SyncState.SKIPPED);
                return run;
            }
            if (!run.getContendedKeys().isEmpty()) {
                log.info("Sync run {} proceeding without {} contended resource(s): {}", run.getRunId(),
                        run.getContendedKeys().size(), run.getContendedKeys());
            }

            transition(run, SyncState.READING);
            Instant readStartedAt = clock.instant();
            run.markReadStarted(readStartedAt);
            List<SideReads> reads = new ArrayList<>();
            for (Lease lease : leases) {
                readBothSides(lease.getResourceKey(), operation).ifPresent(reads::add);
            }

            transition(run, SyncState.RESOLVING);
            List<BatchItem> items = operation == SyncOperation.INVENTORY
                    ? planInventory(run, reads)
                    : planPrice(run, reads);

            transition(run, SyncState.WRITING);
            BatchRunReport report = items.isEmpty()
                    ? BatchRunReport.empty()
                    : batchExecutor.execute(items, batchOptions, signal);
            run.attachReport(report);
            notifyListeners(listener -> listener.onBatchReport(run, report));
            advanceCheckpoints(operation, reads, report, readStartedAt);

            transition(run, SyncState.COMPLETED);
            if (report.hasFailures()) {
                log.warn("Sync run {} completed with {} failed item(s) of {}", run.getRunId(),
                        report.getFailed(), report.getTotal());
            } else {
                log.info("Sync run {} completed: {} written, {} skipped", run.getRunId(),
                        report.getSucceeded(), report.getSkipped());
            }
        } catch (RuntimeException e) {
            log.error("Sync run {} failed in state {}: {}", run.getRunId(), run.getState(), e.getMessage(), e);
            run.recordFailure(Objects.toString(e.getMessage(), e.getClass().getSimpleName()));
            if (!run.getState().isTerminal()) {
                transition(run, SyncState.FAILED);
            }
        } finally {
            leases.forEach(lockManager::release);
            activeRuns.remove(run.getRunId());
            run.finish(clock.instant());
            notifyListeners(listener -> listener.onRunFinished(run));
        }
        return run;
    }

    /**
     * Asks an in-flight run to stop dispatching write chunks.
     *
     * @return false if no such run is in flight in this process
     */
    public boolean cancel(String runId) {
        CancellationSignal signal = activeRuns.get(runId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        log.info("Cancellation requested for sync run {}", runId);
        return true;
    }

    public Set<String> activeRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    private Optional<SideReads> readBothSides(ResourceKey key, SyncOperation operation) {
        ReadResult source = readService.read(Platform.SOURCE, key, operation);
        ReadResult target = readService.read(Platform.TARGET, key, operation);

        if (source.isOk() || target.isOk()) {
            return Optional.of(new SideReads(key, source.getObservation(), target.getObservation()));
        }
        if (source.getStatus() == ReadResult.Status.NOT_FOUND && target.getStatus() == ReadResult.Status.NOT_FOUND) {
            log.warn("Resource {} not found on either platform; dropping it from this run", key);
            return Optional.empty();
        }
        throw new PlatformUnavailableException(key.value(), "Could not read " + key + " from either platform: "
                + "source=" + source.getMessage() + ", target=" + target.getMessage());
    }

    private List<BatchItem> planInventory(SyncRun run, List<SideReads> reads) {
        List<BatchItem> items = new ArrayList<>();
        for (SideReads read : reads) {
            if (!read.isComplete()) {
                items.add(singleObservationItem(read.present(), read.present().getValue(), SyncOperation.INVENTORY));
                continue;
            }
            if (read.getSource().sameValueAs(read.getTarget())) {
                continue;
            }
            Instant lastSyncedAt = checkpoints.lastSyncedAt(read.getResourceKey(), SyncOperation.INVENTORY)
                    .orElse(null);
            Resolution resolution = conflictResolver.resolveQuantity(
                    read.getResourceKey(), read.getSource(), read.getTarget(), lastSyncedAt);
            record(run, resolution);
            for (Observation observation : List.of(read.getSource(), read.getTarget())) {
                if (observation.getValue().compareTo(resolution.getResolvedValue()) != 0) {
                    items.add(BatchItem.builder()
                            .resourceKey(read.getResourceKey())
                            .platform(observation.getPlatform())
                            .operation(SyncOperation.INVENTORY)
                            .newValue(resolution.getResolvedValue())
                            .currentValue(observation.getValue())
                            .reason(resolution.getStrategy().getCode())
                            .build());
                }
            }
        }
        return items;
    }

    /**
     * Only the target platform is written; its price is derived from the source price.
     */
    private List<BatchItem> planPrice(SyncRun run, List<SideReads> reads) {
        List<BatchItem> items = new ArrayList<>();
        for (SideReads read : reads) {
            ResourceKey key = read.getResourceKey();
            if (read.getSource() == null) {
                log.warn("No source price for {}; target price left as is", key);
                continue;
            }
            PricingTerms terms = catalog.pricingTermsFor(key);
            BigDecimal expected = terms.roundToMinorUnit(terms.expectedTargetPrice(read.getSource().getValue()));
            if (read.getTarget() == null) {
                items.add(singleObservationItem(read.getSource(), expected, SyncOperation.PRICE));
                continue;
            }
            if (read.getTarget().getValue().compareTo(expected) == 0) {
                continue;
            }
            Resolution resolution = conflictResolver.resolvePrice(
                    key, read.getSource(), read.getTarget(), terms);
            record(run, resolution);
            if (resolution.isWriteRequired()) {
                items.add(BatchItem.builder()
                        .resourceKey(key)
                        .platform(Platform.TARGET)
                        .operation(SyncOperation.PRICE)
                        .newValue(resolution.getResolvedValue())
                        .currentValue(read.getTarget().getValue())
                        .reason(resolution.getStrategy().getCode())
                        .build());
            }
        }
        return items;
    }

    private BatchItem singleObservationItem(Observation present, BigDecimal value, SyncOperation operation) {
        Platform missing = present.getPlatform().other();
        log.info("Only {} has {}; writing {} to {}", present.getPlatform(), present.getResourceKey(), value, missing);
        return BatchItem.builder()
                .resourceKey(present.getResourceKey())
                .platform(missing)
                .operation(operation)
                .newValue(value)
                .reason(SINGLE_OBSERVATION)
                .build();
    }

    private void record(SyncRun run, Resolution resolution) {
        run.addResolution(resolution);
        notifyListeners(listener -> listener.onResolution(run, resolution));
    }

    /**
     * Resources read on both sides with no failed write are now in sync as of the read start.
     * Checkpoint failures only delay the next latest-transaction decision, so they do not fail the run.
     */
    private void advanceCheckpoints(SyncOperation operation, List<SideReads> reads, BatchRunReport report,
                                    Instant syncedAt) {
        Set<ResourceKey> failedKeys = report.getFailures().stream()
                .map(ItemFailure::getResourceKey)
                .collect(Collectors.toSet());
        for (SideReads read : reads) {
            if (!read.isComplete() || failedKeys.contains(read.getResourceKey())) {
                continue;
            }
            try {
                checkpoints.markSynced(read.getResourceKey(), operation, syncedAt);
            } catch (RuntimeException e) {
                log.warn("Could not advance {} checkpoint for {}: {}", operation, read.getResourceKey(), e.getMessage());
            }
        }
    }

    private void transition(SyncRun run, SyncState next) {
        SyncState previous = run.transitionTo(next, clock.instant());
        log.debug("Sync run {}: {} -> {}", run.getRunId(), previous, next);
        notifyListeners(listener -> listener.onStateChange(run, previous, next));
    }

    private void notifyListeners(Consumer<SyncEventListener> event) {
        for (SyncEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Sync event listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private static List<ResourceKey> normalize(Collection<String> rawKeys) {
        if (rawKeys == null || rawKeys.isEmpty()) {
            throw new IllegalArgumentException("At least one resource key is required");
        }
        Set<ResourceKey> keys = new LinkedHashSet<>();
        for (String raw : rawKeys) {
            keys.add(ResourceKey.of(raw));
        }
        return List.copyOf(keys);
    }

    @Value
    private static class SideReads {
        ResourceKey resourceKey;
        Observation source;
        Observation target;

        boolean isComplete() {
            return source != null && target != null;
        }

        Observation present() {
            return source != null ? source : target;
        }
    }
}
