package com.commerce.sync.domain;

/**
 * Lifecycle of a sync run.
 * <pre>
 * IDLE -> LOCKING -> READING -> RESOLVING -> WRITING -> COMPLETED
 *            \-> SKIPPED           (lease already held elsewhere)
 * any non-terminal state -> FAILED (unrecoverable error)
 * </pre>
 */
public enum SyncState {
    IDLE,
    LOCKING,
    READING,
    RESOLVING,
    WRITING,

    /**
     * The run finished. Individual items may still have failed; see the batch report.
     */
    COMPLETED,

    /**
     * Another run already holds every requested lease. Expected contention, not an error.
     */
    SKIPPED,

    /**
     * The run could not finish (coordination store, ledger or both platforms unavailable).
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == FAILED;
    }

    public boolean canTransitionTo(SyncState next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        return switch (this) {
            case IDLE -> next == LOCKING;
            case LOCKING -> next == READING || next == SKIPPED;
            case READING -> next == RESOLVING;
            case RESOLVING -> next == WRITING;
            case WRITING -> next == COMPLETED;
            case COMPLETED, SKIPPED, FAILED -> false;
        };
    }
}
