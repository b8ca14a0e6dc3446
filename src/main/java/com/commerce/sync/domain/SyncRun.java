package com.commerce.sync.domain;

import com.commerce.sync.service.batch.BatchRunReport;
import lombok.Getter;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One orchestrator run over a set of resources for one operation.
 * <p>
 * Mutated only by the orchestrator thread that owns it; safe to read once {@link #getState()}
 * is terminal.
 */
@Getter
public class SyncRun {

    private final String runId;
    private final SyncOperation operation;
    private final List<ResourceKey> resourceKeys;
    private final Instant startedAt;

    private volatile SyncState state = SyncState.IDLE;
    private Instant readStartedAt;
    private Instant finishedAt;
    private BatchRunReport report;
    private String failureCause;

    private final List<ResourceKey> contendedKeys = new ArrayList<>();
    private final List<Resolution> resolutions = new ArrayList<>();
    private final List<StateChange> history = new ArrayList<>();

    public SyncRun(String runId, SyncOperation operation, List<ResourceKey> resourceKeys, Instant startedAt) {
        this.runId = runId;
        this.operation = operation;
        this.resourceKeys = List.copyOf(resourceKeys);
        this.startedAt = startedAt;
    }

    /**
     * Moves the run to {@code next}.
     *
     * @return the previous state
     * @throws IllegalStateException if the transition is not part of the lifecycle
     */
    public SyncState transitionTo(SyncState next, Instant at) {
        SyncState previous = state;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal sync run transition " + previous + " -> " + next
                    + " for run " + runId);
        }
        state = next;
        history.add(new StateChange(previous, next, at));
        return previous;
    }

    public void markReadStarted(Instant at) {
        this.readStartedAt = at;
    }

    public void addContendedKey(ResourceKey key) {
        contendedKeys.add(key);
    }

    public void addResolution(Resolution resolution) {
        resolutions.add(resolution);
    }

    public void attachReport(BatchRunReport report) {
        this.report = report;
    }

    public void recordFailure(String cause) {
        this.failureCause = cause;
    }

    public void finish(Instant at) {
        this.finishedAt = at;
    }

    public List<ResourceKey> getContendedKeys() {
        return Collections.unmodifiableList(contendedKeys);
    }

    public List<Resolution> getResolutions() {
        return Collections.unmodifiableList(resolutions);
    }

    public List<StateChange> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * A run that finished but left some items failed. Alerting treats this as partial degradation,
     * distinct from a {@link SyncState#FAILED} run.
     */
    public boolean isDegraded() {
        return state == SyncState.COMPLETED && report != null && report.getFailed() > 0;
    }

    public boolean reached(SyncState candidate) {
        return history.stream().anyMatch(change -> change.getTo() == candidate);
    }

    public Duration getDuration() {
        if (finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    @Value
    public static class StateChange {
        SyncState from;
        SyncState to;
        Instant at;
    }
}
