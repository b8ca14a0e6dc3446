package com.commerce.sync.domain;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A quantity or price read live from one platform. Never persisted.
 */
@Value
public class Observation {

    @NonNull ResourceKey resourceKey;
    @NonNull Platform platform;
    @NonNull BigDecimal value;
    @NonNull Instant observedAt;

    public static Observation of(ResourceKey resourceKey, Platform platform, BigDecimal value, Instant observedAt) {
        return new Observation(resourceKey, platform, value, observedAt);
    }

    public boolean sameValueAs(Observation other) {
        return value.compareTo(other.value) == 0;
    }
}
