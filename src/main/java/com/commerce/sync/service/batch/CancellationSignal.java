package com.commerce.sync.service.batch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asks a running batch to stop dispatching chunks. Checked between chunks only, so a chunk
 * already in flight always completes.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
