package com.commerce.sync.exception;

/**
 * The inventory or price ledger could not be read.
 */
public class LedgerAccessException extends SyncException {

    public LedgerAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
