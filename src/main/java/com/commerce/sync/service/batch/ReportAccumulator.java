package com.commerce.sync.service.batch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Mutable counterpart of {@link BatchRunReport}, confined to the executing thread.
 */
class ReportAccumulator {

    private final int total;
    private int succeeded;
    private int failed;
    private int skipped;
    private int chunksDispatched;
    private boolean cancelled;
    private final List<ItemFailure> failures = new ArrayList<>();

    ReportAccumulator(int total) {
        this.total = total;
    }

    void succeeded() {
        succeeded++;
    }

    void failed(BatchItem item, String message, Instant at) {
        failed++;
        failures.add(new ItemFailure(item.getResourceKey(), item.getPlatform(), message, at));
    }

    void skipped() {
        skipped++;
    }

    void skipAll(Collection<BatchItem> items) {
        skipped += items.size();
    }

    void chunkDispatched() {
        chunksDispatched++;
    }

    void markCancelled() {
        cancelled = true;
    }

    int failedSoFar() {
        return failed;
    }

    BatchRunReport build(Duration elapsed) {
        if (succeeded + failed + skipped != total) {
            throw new IllegalStateException("Batch report does not add up: " + succeeded + " succeeded + "
                    + failed + " failed + " + skipped + " skipped != " + total);
        }
        return BatchRunReport.builder()
                .total(total)
                .succeeded(succeeded)
                .failed(failed)
                .skipped(skipped)
                .failures(failures)
                .chunksDispatched(chunksDispatched)
                .cancelled(cancelled)
                .elapsed(elapsed)
                .build();
    }
}
