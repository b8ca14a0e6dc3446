package com.commerce.sync.service.platform;

import com.commerce.sync.domain.Observation;
import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.domain.SyncOperation;
import com.commerce.sync.exception.PlatformApiException;
import com.commerce.sync.exception.ResourceNotFoundOnPlatformException;
import com.commerce.sync.service.resilience.RemoteCallGuard;
import com.commerce.sync.service.resilience.RetryPolicies;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads observations from the platforms with a bounded number of retries and a per-call
 * time limit. A side that stays unreachable is reported as unavailable rather than thrown,
 * so the orchestrator can carry on with the other side.
 */
@Slf4j
public class PlatformReadService {

    private final Map<Platform, PlatformReader> readers = new EnumMap<>(Platform.class);
    private final Map<Platform, Retry> retries = new EnumMap<>(Platform.class);
    private final RemoteCallGuard guard;

    public PlatformReadService(Collection<? extends PlatformReader> readers, RetryPolicies retryPolicies,
                               RemoteCallGuard guard, ReadRetryOptions options) {
        this.guard = guard;
        for (PlatformReader reader : readers) {
            Platform platform = reader.platform();
            if (this.readers.putIfAbsent(platform, reader) != null) {
                throw new IllegalArgumentException("More than one reader registered for " + platform);
            }
            this.retries.put(platform, retryPolicies.create("platform-read-" + platform.name().toLowerCase(Locale.ROOT),
                    options.getMaxRetries(), options.backoffPolicy()));
        }
    }

    public ReadResult read(Platform platform, ResourceKey resourceKey, SyncOperation operation) {
        PlatformReader reader = readers.get(platform);
        if (reader == null) {
            return ReadResult.unavailable("No reader configured for " + platform);
        }
        String callName = operation == SyncOperation.INVENTORY ? "getQuantity" : "getPrice";
        try {
            Observation observation = retries.get(platform).executeSupplier(() ->
                    guard.call(platform, resourceKey.value(), callName, () -> operation == SyncOperation.INVENTORY
                            ? reader.getQuantity(resourceKey)
                            : reader.getPrice(resourceKey)));
            log.debug("Read {} {} = {} from {}", callName, resourceKey, observation.getValue(), platform);
            return ReadResult.ok(observation);
        } catch (ResourceNotFoundOnPlatformException e) {
            log.info("Resource {} not found on {}", resourceKey, platform);
            return ReadResult.notFound(e.getMessage());
        } catch (PlatformApiException | UncheckedIOException e) {
            log.warn("Could not read {} for {} from {}: {}", callName, resourceKey, platform, e.getMessage());
            return ReadResult.unavailable(e.getMessage());
        }
    }
}
