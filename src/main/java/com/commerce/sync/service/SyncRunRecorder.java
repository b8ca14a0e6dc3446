package com.commerce.sync.service;

import com.commerce.sync.domain.Resolution;
import com.commerce.sync.domain.ResolutionStrategy;
import com.commerce.sync.domain.SyncRun;
import com.commerce.sync.domain.SyncState;
import com.commerce.sync.dto.SyncStats;
import com.commerce.sync.entity.ConflictRecord;
import com.commerce.sync.entity.SyncRunRecord;
import com.commerce.sync.repository.ConflictRecordRepository;
import com.commerce.sync.repository.SyncRunRepository;
import com.commerce.sync.service.batch.BatchRunReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Persists run history and the conflict log, and publishes run metrics.
 * <p>
 * Metrics:
 * - sync.runs{state}: finished runs per terminal state
 * - sync.batch.items{outcome}: written, failed and skipped items
 * - sync.conflicts{strategy}: resolutions per strategy
 * - sync.run.duration: wall time of each run
 */
@Component
@Slf4j
public class SyncRunRecorder implements SyncEventListener {

    private final SyncRunRepository runRepository;
    private final ConflictRecordRepository conflictRepository;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<SyncState, Counter> runCounters = new EnumMap<>(SyncState.class);
    private final Map<ResolutionStrategy, Counter> conflictCounters = new EnumMap<>(ResolutionStrategy.class);
    private Counter itemsSucceeded;
    private Counter itemsFailed;
    private Counter itemsSkipped;
    private Timer runTimer;

    public SyncRunRecorder(SyncRunRepository runRepository,
                           ConflictRecordRepository conflictRepository,
                           MeterRegistry meterRegistry,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.runRepository = runRepository;
        this.conflictRepository = conflictRepository;
        this.meterRegistry = meterRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        for (SyncState state : List.of(SyncState.COMPLETED, SyncState.SKIPPED, SyncState.FAILED)) {
            runCounters.put(state, Counter.builder("sync.runs")
                    .description("Finished sync runs by terminal state")
                    .tag("state", state.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        for (ResolutionStrategy strategy : ResolutionStrategy.values()) {
            conflictCounters.put(strategy, Counter.builder("sync.conflicts")
                    .description("Conflict resolutions by strategy")
                    .tag("strategy", strategy.getCode())
                    .register(meterRegistry));
        }

        itemsSucceeded = itemCounter("succeeded");
        itemsFailed = itemCounter("failed");
        itemsSkipped = itemCounter("skipped");

        runTimer = Timer.builder("sync.run.duration")
                .description("Time taken to complete a sync run")
                .register(meterRegistry);
    }

    private Counter itemCounter(String outcome) {
        return Counter.builder("sync.batch.items")
                .description("Batch items by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    @Override
    public void onResolution(SyncRun run, Resolution resolution) {
        conflictCounters.get(resolution.getStrategy()).increment();
        conflictRepository.save(ConflictRecord.builder()
                .runId(run.getRunId())
                .resourceKey(resolution.getResourceKey().value())
                .conflictType(resolution.getConflictType())
                .strategy(resolution.getStrategy())
                .resolvedValue(resolution.getResolvedValue())
                .writeRequired(resolution.isWriteRequired())
                .evidence(evidenceOf(resolution))
                .resolvedAt(resolution.getResolvedAt())
                .build());
    }

    @Override
    public void onBatchReport(SyncRun run, BatchRunReport report) {
        itemsSucceeded.increment(report.getSucceeded());
        itemsFailed.increment(report.getFailed());
        itemsSkipped.increment(report.getSkipped());
    }

    @Override
    public void onRunFinished(SyncRun run) {
        Counter counter = runCounters.get(run.getState());
        if (counter != null) {
            counter.increment();
        }
        runTimer.record(run.getDuration());

        BatchRunReport report = run.getReport();
        runRepository.save(SyncRunRecord.builder()
                .runId(run.getRunId())
                .operation(run.getOperation())
                .state(run.getState())
                .requestedKeys(run.getResourceKeys().size())
                .contendedKeys(run.getContendedKeys().size())
                .resolutionCount(run.getResolutions().size())
                .totalItems(report != null ? report.getTotal() : 0)
                .succeededCount(report != null ? report.getSucceeded() : 0)
                .failedCount(report != null ? report.getFailed() : 0)
                .skippedCount(report != null ? report.getSkipped() : 0)
                .cancelled(report != null && report.isCancelled())
                .failureCause(truncate(run.getFailureCause()))
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .durationMs(run.getDuration().toMillis())
                .build());

        if (run.isDegraded()) {
            log.warn("Sync run {} is degraded: {} of {} items failed", run.getRunId(),
                    report.getFailed(), report.getTotal());
        }
    }

    /**
     * Run counts cover all recorded runs; conflict counts cover only the last {@code days} days.
     */
    @Transactional(readOnly = true)
    public SyncStats getStats(Set<String> activeRunIds, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        Instant since = clock.instant().minus(Duration.ofDays(days));
        Map<SyncState, Long> runsByState = new EnumMap<>(SyncState.class);
        for (Object[] row : runRepository.countGroupedByState()) {
            runsByState.put((SyncState) row[0], (Long) row[1]);
        }
        Map<String, Long> conflictsByStrategy = new LinkedHashMap<>();
        for (Object[] row : conflictRepository.countGroupedByStrategy(since)) {
            conflictsByStrategy.put(((ResolutionStrategy) row[0]).getCode(), (Long) row[1]);
        }
        long degraded = runRepository.countByStateAndFailedCountGreaterThan(SyncState.COMPLETED, 0);

        return SyncStats.builder()
                .runsByState(runsByState)
                .degradedRuns(degraded)
                .conflictsByStrategy(conflictsByStrategy)
                .conflictWindowDays(days)
                .activeRunIds(activeRunIds)
                .build();
    }

    private String evidenceOf(Resolution resolution) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("observations", resolution.getObservations());
        evidence.put("ledgerEntries", resolution.getLedgerEntries());
        evidence.put("inputs", resolution.getInputs());
        evidence.put("referenceTime", resolution.getReferenceTime());
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize evidence for {}; storing plain text: {}",
                    resolution.getResourceKey(), e.getMessage());
            return resolution.toString();
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 500) {
            return value;
        }
        return value.substring(0, 500);
    }
}
