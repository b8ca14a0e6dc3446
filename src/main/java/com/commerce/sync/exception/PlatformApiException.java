package com.commerce.sync.exception;

import com.commerce.sync.domain.Platform;

/**
 * Thrown when a call to one of the commerce platforms fails.
 * This could be a rate-limit response, a 5xx, a timeout or a rejected request.
 */
public class PlatformApiException extends SyncException {

    private final Platform platform;
    private final String resourceKey;
    private final boolean isRetryable;

    public PlatformApiException(String message, Platform platform, String resourceKey, boolean isRetryable) {
        super(message);
        this.platform = platform;
        this.resourceKey = resourceKey;
        this.isRetryable = isRetryable;
    }

    public PlatformApiException(String message, Platform platform, String resourceKey, boolean isRetryable,
                                Throwable cause) {
        super(message, cause);
        this.platform = platform;
        this.resourceKey = resourceKey;
        this.isRetryable = isRetryable;
    }

    public Platform getPlatform() {
        return platform;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    /**
     * Indicates if this error is transient and the operation can be retried.
     * Non-retryable errors include validation rejections and unknown resources.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
