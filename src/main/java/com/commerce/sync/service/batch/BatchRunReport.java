package com.commerce.sync.service.batch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate outcome of one batch execution. {@code succeeded + failed + skipped == total} always holds.
 */
@Value
@Builder
public class BatchRunReport {

    int total;
    int succeeded;
    int failed;
    int skipped;

    @Singular
    List<ItemFailure> failures;

    int chunksDispatched;

    /**
     * True when the run was cancelled before every chunk was dispatched.
     */
    boolean cancelled;

    Duration elapsed;

    public static BatchRunReport empty() {
        return BatchRunReport.builder().elapsed(Duration.ZERO).build();
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public double failureRatio() {
        return total == 0 ? 0.0 : (double) failed / total;
    }
}
