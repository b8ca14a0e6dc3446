package com.commerce.sync.exception;

/**
 * Neither platform could be read for a resource, so the run cannot decide anything safely.
 */
public class PlatformUnavailableException extends SyncException {

    private final String resourceKey;

    public PlatformUnavailableException(String resourceKey, String message) {
        super(message);
        this.resourceKey = resourceKey;
    }

    public String getResourceKey() {
        return resourceKey;
    }
}
