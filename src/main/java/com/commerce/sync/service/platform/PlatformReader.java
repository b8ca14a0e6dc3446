package com.commerce.sync.service.platform;

import com.commerce.sync.domain.Observation;
import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.exception.PlatformApiException;
import com.commerce.sync.exception.ResourceNotFoundOnPlatformException;

/**
 * Read side of one commerce platform.
 * <p>
 * Implementations are thin clients: no retrying, batching or timeouts. Those are applied by
 * {@link PlatformReadService}. A missing resource is reported as
 * {@link ResourceNotFoundOnPlatformException}; any other failure as {@link PlatformApiException},
 * flagged retryable when transient.
 */
public interface PlatformReader {

    Platform platform();

    Observation getQuantity(ResourceKey resourceKey);

    Observation getPrice(ResourceKey resourceKey);
}
