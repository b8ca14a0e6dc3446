package com.commerce.sync.service.platform;

import com.commerce.sync.domain.Platform;
import com.commerce.sync.domain.ResourceKey;

import java.math.BigDecimal;

/**
 * Write side of one commerce platform. Only the batch executor calls this.
 * Failures are reported through the returned {@link WriteOutcome}; a thrown exception is
 * classified the same way a failed outcome would be.
 */
public interface PlatformWriter {

    Platform platform();

    WriteOutcome applyQuantity(ResourceKey resourceKey, BigDecimal quantity);

    WriteOutcome applyPrice(ResourceKey resourceKey, BigDecimal price);

    /**
     * Whether the platform can map the key to one of its own records. Unresolvable items are
     * skipped before any write is attempted.
     */
    default boolean isResolvable(ResourceKey resourceKey) {
        return true;
    }
}
