package com.commerce.sync.exception;

import com.commerce.sync.domain.Platform;

/**
 * The platform has no record of the resource. Never retried.
 */
public class ResourceNotFoundOnPlatformException extends PlatformApiException {

    public ResourceNotFoundOnPlatformException(Platform platform, String resourceKey) {
        super("Resource " + resourceKey + " not found on " + platform, platform, resourceKey, false);
    }
}
