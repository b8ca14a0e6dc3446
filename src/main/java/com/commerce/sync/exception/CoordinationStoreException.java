package com.commerce.sync.exception;

/**
 * The coordination store holding leases could not be reached or rejected a command.
 */
public class CoordinationStoreException extends SyncException {

    public CoordinationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
