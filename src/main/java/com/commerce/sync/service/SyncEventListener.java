package com.commerce.sync.service;

import com.commerce.sync.domain.Resolution;
import com.commerce.sync.domain.SyncRun;
import com.commerce.sync.domain.SyncState;
import com.commerce.sync.service.batch.BatchRunReport;

/**
 * Receives structured events from sync runs. Called on the run's thread; exceptions thrown by a
 * listener are logged and otherwise ignored.
 */
public interface SyncEventListener {

    default void onStateChange(SyncRun run, SyncState from, SyncState to) {
    }

    default void onResolution(SyncRun run, Resolution resolution) {
    }

    default void onBatchReport(SyncRun run, BatchRunReport report) {
    }

    default void onRunFinished(SyncRun run) {
    }
}
