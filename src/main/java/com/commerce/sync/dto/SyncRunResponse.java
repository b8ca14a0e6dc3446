package com.commerce.sync.dto;

import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.domain.SyncRun;
import com.commerce.sync.domain.SyncState;
import com.commerce.sync.service.batch.ItemFailure;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Summary of a finished sync run returned by the API.
 */
@Data
@Builder
public class SyncRunResponse {

    private String runId;
    private SyncOperation operation;
    private SyncState state;
    private boolean degraded;
    private List<String> resourceKeys;
    private List<String> contendedKeys;
    private List<ResolutionSummary> resolutions;
    private int total;
    private int succeeded;
    private int failed;
    private int skipped;
    private boolean cancelled;
    private List<ItemFailure> failures;
    private String failureCause;
    private Instant startedAt;
    private Instant finishedAt;
    private long durationMs;

    public static SyncRunResponse from(SyncRun run) {
        SyncRunResponseBuilder builder = SyncRunResponse.builder()
                .runId(run.getRunId())
                .operation(run.getOperation())
                .state(run.getState())
                .degraded(run.isDegraded())
                .resourceKeys(keys(run.getResourceKeys()))
                .contendedKeys(keys(run.getContendedKeys()))
                .resolutions(run.getResolutions().stream()
                        .map(r -> new ResolutionSummary(r.getResourceKey().value(), r.getStrategy().getCode(),
                                r.getResolvedValue().toPlainString(), r.isWriteRequired()))
                        .collect(Collectors.toList()))
                .failureCause(run.getFailureCause())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .durationMs(run.getDuration().toMillis())
                .failures(List.of());
        if (run.getReport() != null) {
            builder.total(run.getReport().getTotal())
                    .succeeded(run.getReport().getSucceeded())
                    .failed(run.getReport().getFailed())
                    .skipped(run.getReport().getSkipped())
                    .cancelled(run.getReport().isCancelled())
                    .failures(run.getReport().getFailures());
        }
        return builder.build();
    }

    private static List<String> keys(List<ResourceKey> keys) {
        return keys.stream().map(ResourceKey::value).collect(Collectors.toList());
    }

    @Data
    public static class ResolutionSummary {
        private final String resourceKey;
        private final String strategy;
        private final String resolvedValue;
        private final boolean writeRequired;
    }
}
