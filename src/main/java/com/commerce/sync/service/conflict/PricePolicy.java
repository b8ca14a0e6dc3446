package com.commerce.sync.service.conflict;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Business tolerances for price conflicts.
 */
@Value
@Builder
public class PricePolicy {

    /**
     * Differences strictly below this percentage of the expected price are ignored.
     */
    @Builder.Default
    BigDecimal ignoreThresholdPercent = new BigDecimal("5");

    /**
     * How long a manual price change keeps priority over automation.
     */
    @Builder.Default
    Duration manualOverrideWindow = Duration.ofHours(24);

    public static PricePolicy defaults() {
        return PricePolicy.builder().build();
    }
}
